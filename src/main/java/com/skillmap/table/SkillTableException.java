package com.skillmap.table;

public class SkillTableException extends RuntimeException {
    public SkillTableException(String message) {
        super(message);
    }

    public SkillTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
