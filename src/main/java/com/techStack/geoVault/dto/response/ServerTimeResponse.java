package com.techStack.geoVault.dto.response;

import java.time.Instant;

public record ServerTimeResponse(Instant utc, String localTime, String zone) {
}
