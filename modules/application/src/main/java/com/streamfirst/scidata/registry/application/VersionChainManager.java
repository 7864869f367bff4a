package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.domain.ChainConflictException;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.ports.DatasetRepositoryPort;
import com.streamfirst.scidata.registry.ports.VersionLinkRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maintains the linear "replaces" relation between dataset versions.
 *
 * <p>Every version has at most one predecessor and at most one direct successor, and the chain
 * is acyclic. Direct neighbours are answered from the stored indexes; {@link #chainOf} walks the
 * links and stops at the first repeated node should the stored links ever be malformed.
 */
@Slf4j
@RequiredArgsConstructor
public class VersionChainManager {

    private final VersionLinkRepositoryPort links;
    private final DatasetRepositoryPort datasets;

    /**
     * Records that {@code newId} replaces {@code predecessorId}. Callers must hold the locks of
     * both datasets.
     *
     * @throws ChainConflictException if the link is not allowed, see {@link #checkLinkable}
     */
    public void link(DatasetId newId, DatasetId predecessorId) {
        checkLinkable(newId, predecessorId);
        StorageCalls.run("link " + newId + " to " + predecessorId, () -> {
            try {
                links.link(newId, predecessorId);
            } catch (IllegalStateException e) {
                throw new ChainConflictException(e.getMessage());
            }
        });
        log.info("Dataset {} now replaces {}", newId, predecessorId);
    }

    /**
     * Checks, without changing anything, that {@code newId} may be linked to
     * {@code predecessorId}.
     *
     * @throws ChainConflictException if the predecessor is unknown or already replaced, if
     *     {@code newId} already replaces something, or if the link would create a cycle
     */
    public void checkLinkable(DatasetId newId, DatasetId predecessorId) {
        if (newId.equals(predecessorId)) {
            throw new ChainConflictException("Dataset " + newId + " cannot replace itself");
        }
        if (!datasets.exists(predecessorId)) {
            throw new ChainConflictException("Predecessor " + predecessorId + " does not exist");
        }
        Optional<DatasetId> existingSuccessor = links.successorOf(predecessorId);
        if (existingSuccessor.isPresent()) {
            throw new ChainConflictException("Dataset " + predecessorId + " is already replaced by "
                + existingSuccessor.get());
        }
        Optional<DatasetId> existingPredecessor = links.predecessorOf(newId);
        if (existingPredecessor.isPresent()) {
            throw new ChainConflictException("Dataset " + newId + " already replaces "
                + existingPredecessor.get());
        }
        if (reachesBackwards(predecessorId, newId)) {
            throw new ChainConflictException("Linking " + newId + " to " + predecessorId
                + " would create a cycle");
        }
    }

    public Optional<DatasetId> predecessorOf(DatasetId id) {
        return links.predecessorOf(id);
    }

    public Optional<DatasetId> successorOf(DatasetId id) {
        return links.successorOf(id);
    }

    /**
     * Returns the full chain containing {@code id}, oldest version first.
     *
     * @return the ordered versions; just {@code id} when it is unlinked
     */
    public List<DatasetId> chainOf(DatasetId id) {
        Deque<DatasetId> chain = new ArrayDeque<>();
        Set<DatasetId> seen = new HashSet<>();
        chain.add(id);
        seen.add(id);

        Optional<DatasetId> previous = links.predecessorOf(id);
        while (previous.isPresent()) {
            if (!seen.add(previous.get())) {
                log.warn("Malformed version chain: {} reached twice walking back from {}", previous.get(), id);
                break;
            }
            chain.addFirst(previous.get());
            previous = links.predecessorOf(previous.get());
        }

        Optional<DatasetId> next = links.successorOf(id);
        while (next.isPresent()) {
            if (!seen.add(next.get())) {
                log.warn("Malformed version chain: {} reached twice walking forward from {}", next.get(), id);
                break;
            }
            chain.addLast(next.get());
            next = links.successorOf(next.get());
        }
        return List.copyOf(chain);
    }

    private boolean reachesBackwards(DatasetId start, DatasetId target) {
        Set<DatasetId> seen = new HashSet<>();
        Optional<DatasetId> current = Optional.of(start);
        while (current.isPresent() && seen.add(current.get())) {
            if (current.get().equals(target)) {
                return true;
            }
            current = links.predecessorOf(current.get());
        }
        return false;
    }
}
