package org.carball.querylens.analyzer;

import org.carball.querylens.model.NPlusOnePattern;
import org.carball.querylens.model.QueryRecord;

/**
 * A classified query and the N+1 alert it raised, if any, still to be dispatched.
 */
public record ClassifiedQuery(QueryRecord record, NPlusOnePattern pendingAlert) {

    public boolean hasPendingAlert() {
        return pendingAlert != null;
    }
}
