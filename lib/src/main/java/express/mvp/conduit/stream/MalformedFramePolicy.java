package express.mvp.conduit.stream;

/** What the dispatcher does with an inbound frame that is not a valid envelope. */
public enum MalformedFramePolicy {

    /** Log the frame and report a {@code MALFORMED_FRAME} error to error listeners. */
    REPORT,

    /** Log the frame and drop it. */
    DROP
}
