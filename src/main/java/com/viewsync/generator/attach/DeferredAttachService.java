package com.viewsync.generator.attach;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.model.ObjectNode;

/**
 * Attaches generated behaviours to their template roots once the host can load them.
 *
 * A request is applied immediately when the type already resolves, otherwise it is queued and
 * retried every time the {@link ReloadSignal} fires. Requests that still do not resolve on a
 * reload go back into the queue.
 */
public class DeferredAttachService {
    private static final Logger log = LoggerFactory.getLogger(DeferredAttachService.class);

    private final TypeRegistry typeRegistry;
    private final TemplateRepository templateRepository;
    private final PendingAttachQueue queue;
    private final List<AttachListener> listeners = new CopyOnWriteArrayList<>();

    public DeferredAttachService(TypeRegistry typeRegistry, TemplateRepository templateRepository,
                                 PendingAttachQueue queue, ReloadSignal reloadSignal) {
        this.typeRegistry = typeRegistry;
        this.templateRepository = templateRepository;
        this.queue = queue;
        reloadSignal.subscribe(this::onReload);
    }

    public void addListener(AttachListener listener) {
        listeners.add(listener);
    }

    public AttachState requestAttach(ObjectNode root, String typeName, String artifactPath) {
        String identity = templateRepository.identityOf(root);
        AttachRequest request = new AttachRequest(identity, typeName, artifactPath == null ? "" : artifactPath);
        Optional<ObjectNode> opened = templateRepository.open(identity);
        if (opened.isPresent() && tryAttach(request, opened.get())) {
            return AttachState.APPLIED;
        }
        if (queue.add(request)) {
            log.info("Type {} not loadable yet, attach to {} deferred until reload", typeName, identity);
        }
        return AttachState.QUEUED;
    }

    public PendingAttachQueue getQueue() {
        return queue;
    }

    /**
     * Retries every queued request. One failing request never stops the others. Requests whose
     * template can no longer be opened are dropped.
     */
    void onReload() {
        List<String> lines = queue.drain();
        if (lines.isEmpty()) {
            return;
        }
        log.debug("Reload: retrying {} pending attach request(s)", lines.size());

        List<AttachRequest> applied = new ArrayList<>();
        for (String line : lines) {
            Optional<AttachRequest> parsed = AttachRequest.parse(line);
            if (parsed.isEmpty()) {
                log.warn("Dropping malformed attach request '{}'", line);
                continue;
            }
            AttachRequest request = parsed.get();
            Optional<ObjectNode> root = templateRepository.open(request.getRootIdentity());
            if (root.isEmpty()) {
                log.warn("Template {} no longer exists, dropping attach of {}",
                        request.getRootIdentity(), request.getTypeName());
                continue;
            }
            try {
                if (tryAttach(request, root.get())) {
                    applied.add(request);
                } else {
                    queue.add(request);
                    log.info("Type {} still not loadable, attach to {} stays queued",
                            request.getTypeName(), request.getRootIdentity());
                }
            } catch (RuntimeException e) {
                log.error("Attach of {} to {} failed", request.getTypeName(), request.getRootIdentity(), e);
            }
        }

        for (AttachRequest request : applied) {
            for (AttachListener listener : listeners) {
                try {
                    listener.onAttached(request);
                } catch (RuntimeException e) {
                    log.error("Attach listener failed for {}", request.encode(), e);
                }
            }
        }
    }

    /**
     * @return false while the type cannot be loaded
     */
    private boolean tryAttach(AttachRequest request, ObjectNode root) {
        Optional<ResolvedType> resolved = resolve(request);
        if (resolved.isEmpty()) {
            return false;
        }

        ResolvedType type = resolved.get();
        if (!type.isBehaviour()) {
            log.debug("{} is not a behaviour, nothing to attach", type.getName());
            return true;
        }
        if (root.hasCapability(type.getName())) {
            return true;
        }
        root.attach(type.newInstance());
        templateRepository.save(request.getRootIdentity(), root);
        log.info("Attached {} to {}", type.getName(), request.getRootIdentity());
        return true;
    }

    private Optional<ResolvedType> resolve(AttachRequest request) {
        if (!request.getArtifactPath().isEmpty()) {
            Optional<ResolvedType> byArtifact = typeRegistry.resolveArtifact(request.getArtifactPath());
            if (byArtifact.isPresent()) {
                return byArtifact;
            }
        }
        return typeRegistry.resolveType(request.getTypeName());
    }
}
