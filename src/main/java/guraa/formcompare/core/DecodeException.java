package guraa.formcompare.core;

import java.io.IOException;

/**
 * Thrown when the input cannot be read as a PDF document.
 */
public class DecodeException extends IOException {

    private final String sourceName;
    private final Long byteOffset;

    public DecodeException(String sourceName, String message, Long byteOffset, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.byteOffset = byteOffset;
    }

    public DecodeException(String sourceName, String message, Long byteOffset) {
        this(sourceName, message, byteOffset, null);
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * @return offset in the input where parsing failed, or null when unknown
     */
    public Long getByteOffset() {
        return byteOffset;
    }
}
