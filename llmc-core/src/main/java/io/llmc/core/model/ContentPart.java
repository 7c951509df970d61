package io.llmc.core.model;

import java.util.Objects;

/**
 * One typed piece of a multi-part message: {@code text}, {@code image_url} or {@code input_audio}.
 */
public record ContentPart(String type, String text, String url, String data, String format) {

    public static final String TEXT = "text";
    public static final String IMAGE_URL = "image_url";
    public static final String INPUT_AUDIO = "input_audio";
    /** Joins the text parts of one message wherever they are flattened to plain text. */
    public static final String TEXT_SEPARATOR = " ";

    public ContentPart {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static ContentPart text(String text) {
        return new ContentPart(TEXT, text == null ? "" : text, null, null, null);
    }

    public static ContentPart imageUrl(String url) {
        return new ContentPart(IMAGE_URL, null, Objects.requireNonNull(url, "url must not be null"), null, null);
    }

    public static ContentPart inputAudio(String base64Data, String format) {
        return new ContentPart(INPUT_AUDIO, null, null, Objects.requireNonNull(base64Data, "data must not be null"), format);
    }
}
