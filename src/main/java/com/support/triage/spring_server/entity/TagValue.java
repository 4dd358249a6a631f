package com.support.triage.spring_server.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Value of an issue tag. A tag holds exactly one of text, number or flag, as named by {@link #type}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagValue {

    public enum Type { TEXT, NUMBER, FLAG }

    private Type type;
    private String text;
    private Double number;
    private Boolean flag;

    public static TagValue of(String text) {
        return new TagValue(Type.TEXT, text, null, null);
    }

    public static TagValue of(double number) {
        return new TagValue(Type.NUMBER, null, number, null);
    }

    public static TagValue of(boolean flag) {
        return new TagValue(Type.FLAG, null, null, flag);
    }

    public Object value() {
        if (type == null) {
            return null;
        }
        return switch (type) {
            case TEXT -> text;
            case NUMBER -> number;
            case FLAG -> flag;
        };
    }
}
