package com.pascals.compiler.error;

public class InvalidRecordAccessException extends SemanticException {
    public InvalidRecordAccessException(String recordName, String fieldName) {
        super("Record '" + recordName + "' has no field '" + fieldName + "'", fieldName);
    }
}
