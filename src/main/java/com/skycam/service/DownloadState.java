package com.skycam.service;

// Ultima descarga aceptada: fecha Last-Modified (ms) y SHA-1 del contenido. Una imagen solo
// es nueva si cambian las dos.
public class DownloadState {

    private long lastModified = Long.MIN_VALUE;
    private String hash = "";

    public synchronized boolean isNewModification(long modified) {
        return modified != lastModified;
    }

    public synchronized boolean isNewContent(String contentHash) {
        return !hash.equals(contentHash);
    }

    public synchronized void markModification(long modified) {
        this.lastModified = modified;
    }

    public synchronized void markContent(String contentHash) {
        this.hash = contentHash;
    }

    public synchronized long getLastModified() {
        return lastModified;
    }

    public synchronized String getHash() {
        return hash;
    }
}
