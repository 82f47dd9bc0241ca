package com.phillippitts.commandrouter.exception;

/**
 * Thrown when a spoken name cannot be resolved against a candidate directory.
 */
public class EntityNotFoundException extends CommandRouterException {

    private final String query;
    private final String directory;

    public EntityNotFoundException(String query, String directory) {
        super("No match for '" + query + "' (directory: " + directory + ")");
        this.query = query;
        this.directory = directory;
    }

    public String getQuery() {
        return query;
    }

    public String getDirectory() {
        return directory;
    }
}
