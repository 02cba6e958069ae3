package com.skycam.service;

// El catalogo de estrellas o de puntos de interes no se puede leer. Es fatal.
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
