package com.claimvoyant.exception;

public class ClaimInputException extends RuntimeException {

    public ClaimInputException(String message) {
        super(message);
    }
}
