package mgnrega.tracker.service;

public class SyncLogNotFoundException extends RuntimeException {

    public SyncLogNotFoundException() {
        super("No sync has run yet");
    }
}
