package com.kmg.extract.model;

public class NoUsableCredentialException extends ExtractionException {
    public NoUsableCredentialException(String message) {
        super(ErrorKind.NO_USABLE_CREDENTIAL, message);
    }
}
