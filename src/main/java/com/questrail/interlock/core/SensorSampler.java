package com.questrail.interlock.core;

import com.questrail.interlock.api.LockState;
import com.questrail.interlock.io.SensorTable;
import com.questrail.interlock.io.SignalName;
import com.questrail.interlock.io.SignalReader;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SensorSampler
 * -----------------------------------------------------------------------------
 * Owns the current {@link SensorSnapshot} of one chamber.
 *
 * <h2>Refresh contract</h2>
 * <ul>
 *   <li>Each wired reader is invoked exactly once per {@link #refresh()}.</li>
 *   <li>The snapshot is swapped in one step, only after every read succeeded.
 *       A failing reader leaves the previous snapshot current.</li>
 *   <li>{@link #current()} may be called from any thread.</li>
 * </ul>
 */
public final class SensorSampler
{
    private static final SignalName[] PRODUCT_SIGNALS = { SignalName.PRODUCT_1, SignalName.PRODUCT_2 };
    private static final SignalName[] SAUCE_SIGNALS = { SignalName.SAUCE_1, SignalName.SAUCE_2, SignalName.SAUCE_3 };

    private final SensorTable sensors;
    private final AtomicReference<SensorSnapshot> current = new AtomicReference<>(SensorSnapshot.initial());

    public SensorSampler(SensorTable sensors) {
        this.sensors = Objects.requireNonNull(sensors, "sensors");
    }

    /**
     * Reads every wired signal and publishes a new snapshot.
     *
     * @return the new snapshot
     * @throws SensorReadException if any reader fails
     */
    public SensorSnapshot refresh() {
        Map<SignalName, Boolean> values = new EnumMap<>(SignalName.class);
        for (SignalName signal : sensors.signals()) {
            SignalReader reader = sensors.reader(signal).orElseThrow();
            try {
                values.put(signal, reader.read());
            } catch (RuntimeException ex) {
                throw new SensorReadException(signal, ex);
            }
        }

        Optional<LockState> lock = values.containsKey(SignalName.LOCK_CONFIRMED)
                ? Optional.of(values.get(SignalName.LOCK_CONFIRMED) ? LockState.LOCKED : LockState.UNLOCKED)
                : Optional.empty();

        SensorSnapshot next = new SensorSnapshot(
                values.getOrDefault(SignalName.CHAMBER_OPEN, false),
                values.getOrDefault(SignalName.PARTITION_UP, false),
                values.getOrDefault(SignalName.PARTITION_DOWN, false),
                lock,
                values.getOrDefault(SignalName.MOTOR_FAULT, false),
                collect(values, PRODUCT_SIGNALS),
                collect(values, SAUCE_SIGNALS));

        current.set(next);
        return next;
    }

    public SensorSnapshot current() {
        return current.get();
    }

    private static List<Boolean> collect(Map<SignalName, Boolean> values, SignalName[] signals) {
        List<Boolean> out = new ArrayList<>(signals.length);
        for (SignalName s : signals) {
            Boolean v = values.get(s);
            if (v != null) {
                out.add(v);
            }
        }
        return out;
    }
}
