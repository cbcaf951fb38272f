package org.tunnelsat.smt;


/**
 * Knobs controlling what {@link Encoder#verify()} does with a model.
 */
public class EncoderSettings {

    private boolean _strictDecoding;

    private boolean _renderTrace;

    private boolean _validatePath;

    public EncoderSettings() {
        _strictDecoding = false;
        _renderTrace = false;
        _validatePath = true;
    }

    /**
     * Fail instead of warning when a model breaks the uniqueness or stack
     * invariants during decoding.
     */
    public boolean getStrictDecoding() {
        return _strictDecoding;
    }

    public EncoderSettings setStrictDecoding(boolean strictDecoding) {
        _strictDecoding = strictDecoding;
        return this;
    }

    public boolean getRenderTrace() {
        return _renderTrace;
    }

    public EncoderSettings setRenderTrace(boolean renderTrace) {
        _renderTrace = renderTrace;
        return this;
    }

    public boolean getValidatePath() {
        return _validatePath;
    }

    public EncoderSettings setValidatePath(boolean validatePath) {
        _validatePath = validatePath;
        return this;
    }
}
