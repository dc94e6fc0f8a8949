package com.linkdrop.api.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// Downloads per token that are counted but not yet finished; a discarded file goes with the last holder
@Component
public class TransferLeases {

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();

    public void acquire(String token) {
        leases.compute(token, (key, lease) -> {
            Lease held = lease == null ? new Lease() : lease;
            held.holders++;
            return held;
        });
    }

    public void markForDiscard(String token) {
        leases.computeIfPresent(token, (key, lease) -> {
            lease.discard = true;
            return lease;
        });
    }

    // True when the caller was the last holder of a discarded lease and must delete the file
    public boolean release(String token) {
        boolean[] deleteFile = {false};
        leases.computeIfPresent(token, (key, lease) -> {
            lease.holders--;
            if (lease.holders > 0) {
                return lease;
            }
            deleteFile[0] = lease.discard;
            return null;
        });
        return deleteFile[0];
    }

    int holders(String token) {
        Lease lease = leases.get(token);
        return lease == null ? 0 : lease.holders;
    }

    // Only touched inside compute on its own key
    private static final class Lease {
        private int holders;
        private boolean discard;
    }
}
