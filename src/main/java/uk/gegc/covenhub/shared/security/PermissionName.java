package uk.gegc.covenhub.shared.security;

public enum PermissionName {
    // Asset Permissions
    ASSET_READ("asset", "read", "View assets and upload progress"),
    ASSET_CREATE("asset", "create", "Upload assets"),
    ASSET_DELETE("asset", "delete", "Cancel uploads"),
    ASSET_ADMIN("asset", "admin", "Full asset administration, including other users' uploads");

    private final String resource;
    private final String action;
    private final String description;

    PermissionName(String resource, String action, String description) {
        this.resource = resource;
        this.action = action;
        this.description = description;
    }

    public String getResource() {
        return resource;
    }

    public String getAction() {
        return action;
    }

    public String getDescription() {
        return description;
    }
}
