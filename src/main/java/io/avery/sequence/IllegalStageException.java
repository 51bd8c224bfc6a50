package io.avery.sequence;

/**
 * Exception thrown when a pipeline stage is assembled over an upstream sequence it cannot run on, such as
 * {@link Seqs#cycle() cycling} a sequence that is not {@link Seq.Sequence#isCopyable copyable}. The exception is thrown
 * when the stage is constructed, before any item is pulled.
 */
public class IllegalStageException extends IllegalArgumentException {
    private final String stage;
    
    /**
     * Constructs an {@code IllegalStageException} for the named stage, with the specified detail message.
     *
     * @param stage the name of the offending stage
     * @param message the detail message
     */
    public IllegalStageException(String stage, String message) {
        super(stage + ": " + message);
        this.stage = stage;
    }
    
    /**
     * Returns the name of the stage that could not be assembled.
     *
     * @return the stage name
     */
    public String stage() {
        return stage;
    }
}
