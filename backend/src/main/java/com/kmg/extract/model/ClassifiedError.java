package com.kmg.extract.model;

public record ClassifiedError(ErrorKind kind, String message) {
}
