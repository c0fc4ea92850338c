package com.herzen.ink.runtime;

import com.herzen.ink.runtime.RuntimeModels.OutputUnit;

import java.util.List;

public final class OutputUnits {

    private OutputUnits() {
    }

    /** Joins lines with a newline, except where glue on either side of the break removes it. */
    public static String join(List<OutputUnit> units) {
        StringBuilder sb = new StringBuilder();
        OutputUnit previous = null;
        for (OutputUnit unit : units) {
            if (previous != null && !previous.glueEnd() && !unit.glueStart()) {
                sb.append('\n');
            }
            sb.append(unit.text());
            previous = unit;
        }
        return sb.toString();
    }
}
