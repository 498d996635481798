package com.itembank.tos.sufficiency;

public class InvalidRequirementMatrixException extends RuntimeException {
    public InvalidRequirementMatrixException(String message) {
        super(message);
    }
}
