package org.ohnlp.cdm.timeline.concurrent;

import java.io.Serializable;

/**
 * A per-person unit of work that threw instead of producing a result.
 */
public class UnitFailure implements Serializable {
    private final String stage;
    private final String personId;
    private final Throwable cause;

    public UnitFailure(String stage, String personId, Throwable cause) {
        this.stage = stage;
        this.personId = personId;
        this.cause = cause;
    }

    public String getStage() {
        return stage;
    }

    public String getPersonId() {
        return personId;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return stage + "[" + personId + "]: " + cause;
    }
}
