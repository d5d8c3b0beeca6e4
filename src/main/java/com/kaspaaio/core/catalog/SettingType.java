package com.kaspaaio.core.catalog;

public enum SettingType {
    STRING,
    NUMBER,
    BOOLEAN,
    PORT,
    ENUM,
    PATH,
    URL,
    KASPA_ADDRESS,
    SECRET
}
