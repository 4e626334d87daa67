package com.lightwatch.dao;

import com.lightwatch.domain.Device;
import com.lightwatch.domain.PowerState;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DeviceStore {

    record NewDevice(long id, long ownerRef, String secretHash, byte[] encryptedSecret, String timezone) {
    }

    /**
     * A single state transition: the device row update and the history append it implies.
     *
     * @param expected state the writer observed; the commit is refused when the stored state differs
     */
    record Transition(long deviceId, PowerState expected, PowerState next, Instant at, Instant lastSeen) {
    }

    Optional<Device> findById(long deviceId);

    Optional<Device> findBySecretHash(String secretHash);

    List<Device> findByOwner(long ownerRef);

    /**
     * Devices that are ON, not paused and whose last heartbeat is strictly before {@code lastSeenBefore}.
     */
    List<Device> findExpired(Instant lastSeenBefore);

    boolean exists(long deviceId);

    boolean secretHashInUse(String secretHash);

    void insert(NewDevice device);

    void updateSecret(long deviceId, String secretHash, byte[] encryptedSecret);

    void updateTimezone(long deviceId, String timezone);

    void updatePaused(long deviceId, boolean paused);

    void updateOwner(long deviceId, long ownerRef);

    boolean delete(long deviceId);

    void touchLastSeen(long deviceId, Instant lastSeen);

    /**
     * Atomically applies the transition to the device row and appends the matching history event.
     *
     * @return false when the stored state no longer equals {@link Transition#expected()}; nothing is written then
     */
    boolean commitTransition(Transition transition);
}
