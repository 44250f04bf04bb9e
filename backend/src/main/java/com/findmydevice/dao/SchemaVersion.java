package com.findmydevice.dao;

public final class SchemaVersion {
    public static final String META_KEY = "db.ver";
    public static final String CURRENT = "20140709";

    private SchemaVersion() {
    }
}
