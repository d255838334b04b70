package com.vanphong.backend.modules.metadata.application;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import com.vanphong.backend.global.error.ProblemException;
import com.vanphong.backend.global.security.Requester;
import com.vanphong.backend.modules.audit.application.AuditLogService;
import com.vanphong.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.vanphong.backend.modules.metadata.domain.MetadataPartition;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MetadataService {

    private static final Logger log = LoggerFactory.getLogger(MetadataService.class);

    static final String METADATA_KEY_REQUIRED = "metadata_key_required";
    static final String ACTION_UPDATE = "METADATA_UPDATE";
    static final String ACTION_DELETE = "METADATA_DELETE";

    private final MetadataTargetRegistry targetRegistry;
    private final OrderTokenTargetLookup orderTokenLookup;
    private final MetadataAccessEvaluator accessEvaluator;
    private final AuditLogService auditLogService;

    public MetadataService(
            MetadataTargetRegistry targetRegistry,
            OrderTokenTargetLookup orderTokenLookup,
            MetadataAccessEvaluator accessEvaluator,
            AuditLogService auditLogService
    ) {
        this.targetRegistry = targetRegistry;
        this.orderTokenLookup = orderTokenLookup;
        this.accessEvaluator = accessEvaluator;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public List<MetadataEntry> get(Requester requester, ResourceClass resourceClass, UUID id, MetadataPartition partition) {
        MetadataTarget target = load(resourceClass, () -> targetRegistry.find(resourceClass, id));
        return read(requester, target, partition);
    }

    @Transactional(readOnly = true)
    public List<MetadataEntry> getOrderByToken(Requester requester, UUID token, MetadataPartition partition) {
        MetadataTarget target = load(ResourceClass.ORDER, () -> orderTokenLookup.findOrderByToken(token));
        return read(requester, target, partition);
    }

    @Transactional(readOnly = true)
    public List<MetadataEntry> getFulfillmentByOrderToken(
            Requester requester,
            UUID token,
            UUID fulfillmentId,
            MetadataPartition partition
    ) {
        MetadataTarget target = load(ResourceClass.FULFILLMENT,
                () -> orderTokenLookup.findFulfillmentByOrderToken(token, fulfillmentId));
        return read(requester, target, partition);
    }

    /**
     * Metadata of the requester's own user record. Self-access opens the public map only.
     */
    @Transactional(readOnly = true)
    public List<MetadataEntry> me(Requester requester, MetadataPartition partition) {
        if (!requester.isUser()) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "unauthorized", "A user access token is required");
        }
        return get(requester, ResourceClass.USER, requester.id(), partition);
    }

    public List<MetadataEntry> update(
            Requester requester,
            ResourceClass resourceClass,
            UUID id,
            MetadataPartition partition,
            Map<String, String> items
    ) {
        Map<String, String> normalized = new LinkedHashMap<>();
        items.forEach((key, value) -> normalized.put(requireKey(key), value == null ? "" : value));

        MetadataTarget target = load(resourceClass, () -> targetRegistry.findForUpdate(resourceClass, id));
        ensureCanModify(requester, target, partition);

        target.entity().storeMetadata(partition, normalized);
        log.info("{} updated {} {} keys {} on {} {}", describe(requester), normalized.size(),
                partition, normalized.keySet(), resourceClass, id);
        audit(requester, target, partition, ACTION_UPDATE, normalized.keySet());
        return entries(target, partition);
    }

    public List<MetadataEntry> delete(
            Requester requester,
            ResourceClass resourceClass,
            UUID id,
            MetadataPartition partition,
            Collection<String> keys
    ) {
        Set<String> normalized = new LinkedHashSet<>();
        keys.forEach(key -> normalized.add(requireKey(key)));

        MetadataTarget target = load(resourceClass, () -> targetRegistry.findForUpdate(resourceClass, id));
        ensureCanModify(requester, target, partition);

        Set<String> removed = target.entity().deleteMetadata(partition, normalized);
        log.info("{} deleted {} keys {} on {} {}", describe(requester), partition, removed, resourceClass, id);
        if (!removed.isEmpty()) {
            audit(requester, target, partition, ACTION_DELETE, removed);
        }
        return entries(target, partition);
    }

    private MetadataTarget load(ResourceClass resourceClass, Supplier<Optional<MetadataTarget>> finder) {
        return finder.get().orElseThrow(() -> new ResourceNotFoundException(resourceClass));
    }

    private List<MetadataEntry> read(Requester requester, MetadataTarget target, MetadataPartition partition) {
        if (!accessEvaluator.isVisible(requester, target)) {
            log.debug("{} cannot see {} {}", describe(requester), target.resourceClass(), target.id());
            throw new ResourceNotFoundException(target.resourceClass());
        }
        if (!accessEvaluator.canView(requester, target, partition)) {
            log.debug("{} denied {} read on {} {}", describe(requester), partition, target.resourceClass(), target.id());
            throw new MetadataAccessDeniedException(
                    "Not allowed to read " + partition.getPathSegment() + " of this " + target.resourceClass().getPathSegment());
        }
        return entries(target, partition);
    }

    private void ensureCanModify(Requester requester, MetadataTarget target, MetadataPartition partition) {
        if (!accessEvaluator.isVisible(requester, target)) {
            log.debug("{} cannot see {} {}", describe(requester), target.resourceClass(), target.id());
            throw new ResourceNotFoundException(target.resourceClass());
        }
        if (!accessEvaluator.canModify(requester, target, partition)) {
            log.debug("{} denied {} write on {} {}", describe(requester), partition, target.resourceClass(), target.id());
            throw new MetadataAccessDeniedException(
                    "Not allowed to modify " + partition.getPathSegment() + " of this " + target.resourceClass().getPathSegment());
        }
    }

    private void audit(Requester requester, MetadataTarget target, MetadataPartition partition, String action, Set<String> keys) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("partition", partition.name());
        detail.put("keys", List.copyOf(keys));
        auditLogService.record(new AuditLogCommand(
                action,
                target.resourceClass().name(),
                target.id().toString(),
                requester.kind(),
                requester.id(),
                detail
        ));
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, METADATA_KEY_REQUIRED, "Metadata keys must not be blank");
        }
        return key.trim();
    }

    private static List<MetadataEntry> entries(MetadataTarget target, MetadataPartition partition) {
        return target.entity().getMetadata(partition).entrySet().stream()
                .map(entry -> new MetadataEntry(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparing(MetadataEntry::key))
                .toList();
    }

    private static String describe(Requester requester) {
        return requester.isAnonymous() ? "ANONYMOUS" : requester.kind() + ":" + requester.id();
    }
}
