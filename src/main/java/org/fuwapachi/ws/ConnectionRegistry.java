package org.fuwapachi.ws;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Ensemble des abonnés WebSocket actuellement connectés.
 *
 * <p>Enregistrement et désenregistrement prennent le verrou d'écriture. {@link #snapshot()}
 * ne garde le verrou de lecture que le temps de copier les références : l'envoi vers
 * chaque connexion se fait ensuite hors verrou, pour qu'une connexion lente ne bloque
 * ni les nouvelles connexions ni les déconnexions.
 */
@Component
public class ConnectionRegistry {

    private final Set<Connection> connections = new LinkedHashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** @return nombre total de connexions après ajout */
    public int register(Connection connection) {
        lock.writeLock().lock();
        try {
            connections.add(connection);
            return connections.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Idempotent : retirer une connexion absente ne fait rien. */
    public int deregister(Connection connection) {
        lock.writeLock().lock();
        try {
            connections.remove(connection);
            return connections.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Connection> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(connections);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
