package com.edutrack.backend.store;

import com.edutrack.backend.exception.EduTrackException;
import com.edutrack.backend.exception.StoreUnavailableException;
import java.util.function.Supplier;

/**
 * Runs a store call and maps whatever it throws, other than errors raised on purpose, to
 * {@link StoreUnavailableException}.
 */
public final class StoreGuard {

    public static <T> T call(Supplier<T> storeCall) {
        try {
            return storeCall.get();
        } catch (EduTrackException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException(e);
        }
    }

    private StoreGuard() {
        throw new UnsupportedOperationException("Utility class");
    }
}
