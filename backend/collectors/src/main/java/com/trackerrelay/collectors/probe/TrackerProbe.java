package com.trackerrelay.collectors.probe;

import com.trackerrelay.core.model.ProbeResult;
import com.trackerrelay.core.model.TrackerScheme;

public interface TrackerProbe {
    boolean supports(TrackerScheme scheme);

    ProbeResult probe(String endpoint);
}
