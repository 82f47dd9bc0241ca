package com.phillippitts.commandrouter.service.executor;

/**
 * Parameter names shared by the classifier patterns, the slot resolver and executors.
 *
 * <p>When a slot is replaced by a canonical directory value, {@code *_name} keeps the name as
 * spoken and {@code *_label} carries the directory's canonical label.
 */
public final class SlotNames {

    public static final String RECIPIENT = "recipient";
    public static final String RECIPIENT_NAME = "recipient_name";
    public static final String RECIPIENT_LABEL = "recipient_label";
    public static final String BODY = "body";
    public static final String ATTACHMENT = "attachment";
    public static final String SUBJECT = "subject";
    public static final String TITLE = "title";
    public static final String WHEN = "when";
    public static final String AMOUNT = "amount";
    public static final String APP = "app";
    public static final String APP_NAME = "app_name";
    public static final String APP_LABEL = "app_label";
    public static final String QUERY = "query";
    public static final String ENGINE = "engine";
    public static final String TOPIC = "topic";

    /** Payload key a file lookup publishes for downstream steps. */
    public static final String FILE_PATH = "file_path";

    private SlotNames() {
    }
}
