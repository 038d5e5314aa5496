package com.programmersdiary.nudge.scheduling;

public class InvalidFieldException extends InvalidScheduleException {

    private final String field;

    public InvalidFieldException(String field, String message) {
        super(field + " field: " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
