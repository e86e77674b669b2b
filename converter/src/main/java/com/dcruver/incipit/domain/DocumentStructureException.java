package com.dcruver.incipit.domain;

/**
 * The document is missing a required part or its references are inconsistent.
 * Fatal for the whole conversion.
 */
public class DocumentStructureException extends RuntimeException {

    public DocumentStructureException(String message) {
        super(message);
    }
}
