package com.openmandi.pricing.api;

import com.openmandi.pricing.api.model.RefreshResponse;
import com.openmandi.pricing.core.MarketSnapshotCache;
import com.openmandi.pricing.core.SnapshotIndex;
import com.openmandi.pricing.core.SnapshotRefresher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/api/v1/market-data")
@RequiredArgsConstructor
public class MarketDataController {
    private final SnapshotRefresher refresher;
    private final MarketSnapshotCache cache;

    @PostMapping("/invalidate")
    public ResponseEntity<RefreshResponse> invalidate() {
        Optional<SnapshotIndex> refreshed = refresher.invalidate();
        SnapshotIndex index = refreshed.orElseGet(cache::current);
        RefreshResponse body = new RefreshResponse(
                refreshed.isPresent(), index.getGeneration(), index.size(), index.getBuiltAt());
        return refreshed.isPresent()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
