package org.tunnelsat.smt;

import org.junit.Test;
import org.tunnelsat.datamodel.Action;
import org.tunnelsat.datamodel.Step;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class VerificationResultTest {

    private static VerificationResult result(List<Step> path, List<String> violations) {
        return new VerificationResult(true, 1, path, violations, null,
                new VerificationStats(2, 1, 1, 4, 10, 0));
    }

    @Test
    public void keepsItsOwnCopies() {
        List<Step> path = new ArrayList<>();
        path.add(new Step(Action.TRANSMIT_A, 0, 1, 0, 0));
        List<String> violations = new ArrayList<>();

        VerificationResult res = result(path, violations);
        path.clear();
        violations.add("late");

        assertEquals(1, res.getPath().size());
        assertTrue(res.getViolations().isEmpty());
        assertTrue(res.isValidPath());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void pathIsReadOnly() {
        List<Step> path = new ArrayList<>();
        result(path, new ArrayList<>()).getPath().add(new Step(Action.TRANSMIT_A, 0, 1, 0, 0));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void violationsAreReadOnly() {
        result(new ArrayList<>(), new ArrayList<>()).getViolations().add("late");
    }
}
