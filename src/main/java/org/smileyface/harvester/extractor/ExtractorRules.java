package org.smileyface.harvester.extractor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative selector rules for {@link SelectorPageExtractor}, bound from configuration.
 *
 * <p>A value selector is a CSS selector, optionally suffixed with {@code @attribute} to read an attribute
 * instead of the element text (e.g. {@code a.website@href}). Inside a group or entity item, a bare
 * {@code @attribute} reads the item element itself.</p>
 */
public class ExtractorRules {

    /** Single-valued fields: field name to value selector (first match). */
    private Map<String, String> fields = new LinkedHashMap<>();

    /** Multi-valued string fields: field name to value selector (all matches, de-duplicated). */
    private Map<String, String> listFields = new LinkedHashMap<>();

    /** List-of-object fields: field name to group rule. */
    private Map<String, GroupRule> groups = new LinkedHashMap<>();

    /** Links to other entities found on the page. */
    private List<EntityRule> entities = new ArrayList<>();

    /** Selector of the "next page" link, if the page is paginated. */
    private String nextPage;

    /** Field names that must be non-empty, otherwise extraction fails. */
    private List<String> required = new ArrayList<>();

    public Map<String, String> getFields() { return fields; }
    public void setFields(Map<String, String> fields) { this.fields = fields != null ? fields : new LinkedHashMap<>(); }

    public Map<String, String> getListFields() { return listFields; }
    public void setListFields(Map<String, String> listFields) { this.listFields = listFields != null ? listFields : new LinkedHashMap<>(); }

    public Map<String, GroupRule> getGroups() { return groups; }
    public void setGroups(Map<String, GroupRule> groups) { this.groups = groups != null ? groups : new LinkedHashMap<>(); }

    public List<EntityRule> getEntities() { return entities; }
    public void setEntities(List<EntityRule> entities) { this.entities = entities != null ? entities : new ArrayList<>(); }

    public String getNextPage() { return nextPage; }
    public void setNextPage(String nextPage) { this.nextPage = nextPage; }

    public List<String> getRequired() { return required; }
    public void setRequired(List<String> required) { this.required = required != null ? required : new ArrayList<>(); }

    /**
     * Repeated block turned into a list of objects, e.g. one map per qualification row.
     */
    public static class GroupRule {

        public GroupRule() {}

        public GroupRule(String itemSelector, Map<String, String> fields) {
            this.itemSelector = itemSelector;
            this.fields = fields;
        }

        private String itemSelector;
        private Map<String, String> fields = new LinkedHashMap<>();

        public String getItemSelector() { return itemSelector; }
        public void setItemSelector(String itemSelector) { this.itemSelector = itemSelector; }

        public Map<String, String> getFields() { return fields; }
        public void setFields(Map<String, String> fields) { this.fields = fields != null ? fields : new LinkedHashMap<>(); }
    }

    /**
     * Repeated card linking to another entity's page.
     */
    public static class EntityRule {

        public EntityRule() {}

        public EntityRule(String type, String itemSelector, String link, String name) {
            this.type = type;
            this.itemSelector = itemSelector;
            this.link = link;
            this.name = name;
        }

        private String type;
        private String itemSelector;
        /** Value selector for the entity URL; defaults to the item's own {@code href} or its first link. */
        private String link;
        /** Value selector for the display name; defaults to the link text. */
        private String name;
        private Map<String, String> fields = new LinkedHashMap<>();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getItemSelector() { return itemSelector; }
        public void setItemSelector(String itemSelector) { this.itemSelector = itemSelector; }

        public String getLink() { return link; }
        public void setLink(String link) { this.link = link; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public Map<String, String> getFields() { return fields; }
        public void setFields(Map<String, String> fields) { this.fields = fields != null ? fields : new LinkedHashMap<>(); }
    }
}
