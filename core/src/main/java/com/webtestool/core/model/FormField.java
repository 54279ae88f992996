package com.webtestool.core.model;

/** 폼 입력 필드 하나(input/select/textarea) */
public record FormField(String name, String type, String value, boolean required) {
    public FormField {
        type = (type == null || type.isBlank()) ? "text" : type.toLowerCase(java.util.Locale.ROOT);
        value = (value == null) ? "" : value;
    }

    public boolean isHidden() { return "hidden".equals(type); }
}
