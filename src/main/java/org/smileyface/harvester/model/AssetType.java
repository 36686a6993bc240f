package org.smileyface.harvester.model;

public enum AssetType {
    IMAGE,
    STYLESHEET,
    SCRIPT,
    FONT,
    VIDEO
}
