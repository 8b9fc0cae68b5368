package com.vcc.admission.event;

import com.vcc.admission.model.Standing;
import com.vcc.admission.model.UsageView;

/**
 * An organization's standing on a quota changed after usage was metered. Notification
 * code listens for transitions into {@link Standing#WARNING_ZONE} to render
 * "approaching your limit" messages; this service only emits the signal.
 */
public record QuotaStandingChangedEvent(Standing previous, Standing current, UsageView usage) {

    public boolean enteredWarningZone() {
        return current == Standing.WARNING_ZONE && previous == Standing.UNDER_LIMIT;
    }
}
