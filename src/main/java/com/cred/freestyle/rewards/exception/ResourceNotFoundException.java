package com.cred.freestyle.rewards.exception;

/**
 * Exception thrown when a referenced account, task, activity, box, product or invitation does not exist.
 *
 * @author Rewards Team
 */
public class ResourceNotFoundException extends RewardRejectedException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(RejectionReason.RESOURCE_NOT_FOUND,
                String.format("%s with ID %s not found", resourceType, resourceId),
                details("resourceType", resourceType, "resourceId", resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
