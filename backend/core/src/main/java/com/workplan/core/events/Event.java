package com.workplan.core.events;

import java.time.Instant;

public interface Event {
    Instant timestamp();

    String workerId();

    String type();
}
