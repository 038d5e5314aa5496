package com.programmersdiary.nudge.scheduling;

public class EmptyFieldException extends InvalidFieldException {

    public EmptyFieldException(String field) {
        super(field, "expands to no values");
    }
}
