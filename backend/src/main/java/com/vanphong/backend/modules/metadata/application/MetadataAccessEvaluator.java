package com.vanphong.backend.modules.metadata.application;

import com.vanphong.backend.global.security.PermissionCode;
import com.vanphong.backend.global.security.Requester;
import com.vanphong.backend.modules.metadata.application.MetadataAccessRule.Ownership;
import com.vanphong.backend.modules.metadata.domain.MetadataPartition;

import org.springframework.stereotype.Component;

/**
 * Stateless evaluator over {@link MetadataAccessPolicy}. Private metadata is only ever granted by
 * the managing permission; ownership and tokens open the public map at most.
 */
@Component
public class MetadataAccessEvaluator {

    private final MetadataAccessPolicy policy;

    public MetadataAccessEvaluator(MetadataAccessPolicy policy) {
        this.policy = policy;
    }

    /**
     * Whether the requester may learn that the target exists. Callers report a miss as not found.
     */
    public boolean isVisible(Requester requester, MetadataTarget target) {
        MetadataAccessRule rule = policy.ruleFor(target.resourceClass());
        PermissionCode required = rule.requiredPermission(target);
        return switch (rule.visibility()) {
            case ALWAYS -> true;
            case LISTED_OR_PERMISSION -> target.listed() || requester.hasPermission(required);
            case LISTED_OWNER_OR_PERMISSION -> target.listed()
                    || requester.isUser(target.ownerUserId())
                    || requester.hasPermission(required);
            case UNOWNED_OWNER_OR_PERMISSION -> target.ownerUserId() == null
                    || requester.isUser(target.ownerUserId())
                    || requester.hasPermission(required);
        };
    }

    public boolean canView(Requester requester, MetadataTarget target, MetadataPartition partition) {
        if (!isVisible(requester, target)) {
            return false;
        }
        MetadataAccessRule rule = policy.ruleFor(target.resourceClass());
        if (isHiddenStaffAccount(requester, target, rule)) {
            return false;
        }
        if (requester.hasPermission(rule.requiredPermission(target))) {
            return true;
        }
        if (partition == MetadataPartition.PRIVATE) {
            return false;
        }
        if (owns(requester, target, rule)) {
            return true;
        }
        return switch (rule.publicRead()) {
            case EVERYONE -> true;
            case OWNER_OR_PERMISSION -> rule.tokenGrantsPublicRead() && target.isTokenLookup();
            case PERMISSION -> false;
        };
    }

    public boolean canModify(Requester requester, MetadataTarget target, MetadataPartition partition) {
        if (!isVisible(requester, target)) {
            return false;
        }
        MetadataAccessRule rule = policy.ruleFor(target.resourceClass());
        if (isHiddenStaffAccount(requester, target, rule)) {
            return false;
        }
        if (requester.hasPermission(rule.requiredPermission(target))) {
            return true;
        }
        return partition == MetadataPartition.PUBLIC && owns(requester, target, rule);
    }

    private boolean isHiddenStaffAccount(Requester requester, MetadataTarget target, MetadataAccessRule rule) {
        return rule.staffHiddenFromApps() && target.staffAccount() && requester.isApp();
    }

    private boolean owns(Requester requester, MetadataTarget target, MetadataAccessRule rule) {
        if (rule.ownership() == Ownership.USER) {
            return requester.isUser(target.ownerUserId());
        }
        if (rule.ownership() == Ownership.APP) {
            return requester.isApp(target.ownerAppId());
        }
        return false;
    }
}
