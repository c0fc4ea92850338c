package com.herzen.ink.markup;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InkValue.Bool.class, name = "bool"),
        @JsonSubTypes.Type(value = InkValue.Int.class, name = "int"),
        @JsonSubTypes.Type(value = InkValue.Decimal.class, name = "float"),
        @JsonSubTypes.Type(value = InkValue.Text.class, name = "string")
})
public sealed interface InkValue {

    String display();

    boolean truthy();

    String typeName();

    record Bool(boolean value) implements InkValue {
        public String display() { return String.valueOf(value); }
        public boolean truthy() { return value; }
        public String typeName() { return "bool"; }
    }

    record Int(long value) implements InkValue {
        public String display() { return String.valueOf(value); }
        public boolean truthy() { return value != 0; }
        public String typeName() { return "int"; }
    }

    record Decimal(double value) implements InkValue {
        public String display() { return String.valueOf(value); }
        public boolean truthy() { return value != 0.0; }
        public String typeName() { return "float"; }
    }

    record Text(String value) implements InkValue {
        public String display() { return value; }
        public boolean truthy() { return !value.isEmpty(); }
        public String typeName() { return "string"; }
    }

    /**
     * Parses a declaration literal: {@code true}, {@code false}, an integer, a float or a double-quoted string.
     *
     * @return the value, or {@code null} when the literal is malformed
     */
    static InkValue parseLiteral(String raw) {
        String s = raw.trim();
        if (s.equals("true")) return new Bool(true);
        if (s.equals("false")) return new Bool(false);
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            String body = s.substring(1, s.length() - 1);
            if (body.replace("\\\"", "").contains("\"")) return null;
            return new Text(body.replace("\\\"", "\""));
        }
        try {
            if (s.matches("-?\\d+")) return new Int(Long.parseLong(s));
            if (s.matches("-?\\d+\\.\\d+")) return new Decimal(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }
}
