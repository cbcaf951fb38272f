package org.tunnelsat.smt;

import java.util.Collections;
import java.util.List;


/**
 * The rendering of a model position by position, together with the warnings
 * raised while rendering it.
 */
public class TraceReport {

    private final String _text;

    private final List<String> _warnings;

    TraceReport(String text, List<String> warnings) {
        _text = text;
        _warnings = Collections.unmodifiableList(warnings);
    }

    public String getText() {
        return _text;
    }

    public List<String> getWarnings() {
        return _warnings;
    }

    public boolean isWellDefined() {
        return _warnings.isEmpty();
    }

    @Override
    public String toString() {
        return _text;
    }
}
