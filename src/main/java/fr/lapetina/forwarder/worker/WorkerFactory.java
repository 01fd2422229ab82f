package fr.lapetina.forwarder.worker;

import fr.lapetina.forwarder.cache.WorkerInfo;

import java.net.InetSocketAddress;

/**
 * Spawns the worker task for a destination.
 *
 * The returned handle is live: its task has been started and owns the
 * receive side of the handle's channel.
 */
@FunctionalInterface
public interface WorkerFactory {

    WorkerInfo spawn(InetSocketAddress destination);
}
