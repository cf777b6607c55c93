package io.mcpgate.core.backend;

import io.mcpgate.core.exception.BackendAlreadyConnectedException;
import io.mcpgate.core.exception.BackendConfigurationException;
import io.mcpgate.core.exception.BackendNotFoundException;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.logging.Logger;

/// Configured backends and their connection status.
///
/// This is the configuration side of the gateway's shared state. Every method acquires the
/// catalog lock for the duration of the call only, so callers never hold it across process
/// spawn or handshake I/O.
///
/// ### Lock Order
/// Flows that touch both the catalog and the live connection registry must call into the
/// catalog first and release it before mutating the registry. The catalog never calls out
/// to other components while locked.
///
/// ### Usage
/// {@snippet :
/// BackendCatalog catalog = new BackendCatalog(List.of(config));
/// ConnectAttempt attempt = catalog.beginConnect("files");   // DISCONNECTED -> CONNECTING
/// // ... spawn and handshake without any lock held ...
/// if (!catalog.markConnected(attempt)) {                   // CONNECTING -> CONNECTED
///     // disconnected, removed or reconnected meanwhile: discard the new connection
/// }
/// }
///
/// @implNote Thread-safe. Insertion order of backends is preserved for listing.
public final class BackendCatalog {

    private static final Logger logger = Logger.getLogger(BackendCatalog.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, BackendState> backends = new LinkedHashMap<>();
    private final Map<String, Long> pendingConnects = new HashMap<>();
    private final Clock clock;
    private long connectSequence;

    /// Creates an empty catalog.
    public BackendCatalog() {
        this(List.of(), Clock.systemUTC());
    }

    /// Creates a catalog with initial backends.
    ///
    /// @param initial backends to add, not null
    /// @throws BackendConfigurationException if two backends share an id
    public BackendCatalog(List<BackendConfig> initial) {
        this(initial, Clock.systemUTC());
    }

    /// Creates a catalog with initial backends and an explicit clock.
    ///
    /// @param initial backends to add, not null
    /// @param clock source of `lastConnected` timestamps, not null
    public BackendCatalog(List<BackendConfig> initial, Clock clock) {
        Objects.requireNonNull(initial, "initial must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        initial.forEach(this::add);
    }

    /// Adds a new backend in `DISCONNECTED` state.
    ///
    /// @param config backend to add, not null
    /// @throws BackendConfigurationException if the id is already taken
    public void add(BackendConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        lock.lock();
        try {
            if (backends.containsKey(config.id())) {
                throw new BackendConfigurationException(
                        "Server with id '" + config.id() + "' already exists");
            }
            backends.put(config.id(), BackendState.initial(config));
        } finally {
            lock.unlock();
        }
        logger.info("Added server " + config.id());
    }

    /// Replaces the configuration of an existing backend, keeping its status.
    ///
    /// @param config new configuration, not null
    /// @throws BackendNotFoundException if no backend has this id
    public void update(BackendConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        mutate(config.id(), state -> state.withConfig(config));
    }

    /// Removes a backend.
    ///
    /// @param id backend identifier, not null
    /// @return the removed state, or empty if absent
    public Optional<BackendState> remove(String id) {
        Objects.requireNonNull(id, "id must not be null");
        lock.lock();
        try {
            pendingConnects.remove(id);
            return Optional.ofNullable(backends.remove(id));
        } finally {
            lock.unlock();
        }
    }

    /// Looks up a backend by id.
    ///
    /// @param id backend identifier, not null
    /// @return backend snapshot, or empty if absent
    public Optional<BackendState> find(String id) {
        Objects.requireNonNull(id, "id must not be null");
        lock.lock();
        try {
            return Optional.ofNullable(backends.get(id));
        } finally {
            lock.unlock();
        }
    }

    /// Looks up a backend by display name.
    ///
    /// @param name display name, not null
    /// @return first backend with this name, or empty
    public Optional<BackendState> findByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        lock.lock();
        try {
            return backends.values().stream()
                    .filter(state -> state.config().name().equals(name))
                    .findFirst();
        } finally {
            lock.unlock();
        }
    }

    /// Returns all backends in insertion order.
    ///
    /// @return immutable snapshot, never null
    public List<BackendState> list() {
        lock.lock();
        try {
            return List.copyOf(backends.values());
        } finally {
            lock.unlock();
        }
    }

    /// Returns the current status of a backend.
    ///
    /// @param id backend identifier, not null
    /// @return current status
    /// @throws BackendNotFoundException if no backend has this id
    public BackendStatus status(String id) {
        return find(id)
                .map(BackendState::status)
                .orElseThrow(() -> new BackendNotFoundException(id));
    }

    /// Validates a connect request and moves the backend to `CONNECTING`.
    ///
    /// @param id backend identifier, not null
    /// @return ticket carrying the configuration snapshot to connect with, never null
    /// @throws BackendNotFoundException if no backend has this id
    /// @throws BackendAlreadyConnectedException if the backend is connecting or connected
    /// @throws BackendConfigurationException if the backend cannot be launched
    public ConnectAttempt beginConnect(String id) {
        Objects.requireNonNull(id, "id must not be null");
        lock.lock();
        try {
            BackendState state = backends.get(id);
            if (state == null) {
                throw new BackendNotFoundException(id);
            }
            if (state.status().isActive()) {
                throw new BackendAlreadyConnectedException(id);
            }
            state.config().requireLaunchable();
            backends.put(id, state.withStatus(BackendStatus.CONNECTING));
            ConnectAttempt attempt = new ConnectAttempt(state.config(), ++connectSequence);
            pendingConnects.put(id, attempt.sequence());
            return attempt;
        } finally {
            lock.unlock();
        }
    }

    /// Records a successful connect if the attempt is still the current one.
    ///
    /// @param attempt ticket from {@link #beginConnect(String)}, not null
    /// @return false if the backend was disconnected, removed or reconnected since the
    ///     attempt began; the caller then owns the new connection and must discard it
    public boolean markConnected(ConnectAttempt attempt) {
        return settle(attempt, state -> state.connected(clock.instant()));
    }

    /// Records a failed connect if the attempt is still the current one.
    ///
    /// @param attempt ticket from {@link #beginConnect(String)}, not null
    /// @param error failure description, may be null
    /// @return false if the attempt was superseded and the status was left unchanged
    public boolean markError(ConnectAttempt attempt, String error) {
        return settle(attempt, state -> state.failed(error));
    }

    /// Records a disconnect, explicit or caused by the backend process exiting.
    ///
    /// Cancels a connect still in progress.
    ///
    /// @param id backend identifier, not null
    /// @throws BackendNotFoundException if no backend has this id
    public void markDisconnected(String id) {
        Objects.requireNonNull(id, "id must not be null");
        lock.lock();
        try {
            BackendState state = backends.get(id);
            if (state == null) {
                throw new BackendNotFoundException(id);
            }
            pendingConnects.remove(id);
            backends.put(id, state.withStatus(BackendStatus.DISCONNECTED));
        } finally {
            lock.unlock();
        }
    }

    /// Returns the number of configured backends.
    ///
    /// @return backend count
    public int size() {
        lock.lock();
        try {
            return backends.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean settle(ConnectAttempt attempt, Function<BackendState, BackendState> change) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        String id = attempt.id();
        lock.lock();
        try {
            Long pending = pendingConnects.get(id);
            BackendState state = backends.get(id);
            if (pending == null || pending != attempt.sequence() || state == null) {
                logger.fine("Ignoring superseded connect attempt for " + id);
                return false;
            }
            pendingConnects.remove(id);
            backends.put(id, change.apply(state));
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void mutate(String id, Function<BackendState, BackendState> change) {
        Objects.requireNonNull(id, "id must not be null");
        lock.lock();
        try {
            BackendState state = backends.get(id);
            if (state == null) {
                throw new BackendNotFoundException(id);
            }
            backends.put(id, change.apply(state));
        } finally {
            lock.unlock();
        }
    }
}
