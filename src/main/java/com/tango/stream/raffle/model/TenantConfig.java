package com.tango.stream.raffle.model;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

@Value
@Builder(toBuilder = true)
public class TenantConfig {
    @Nonnull
    String tenantId;
    @Nonnull
    String channelSlug;
    @Nullable
    Long chatroomId;
    /**
     * Platform-level channel used for subscription and gift events, may be unknown.
     */
    @Nullable
    Long channelId;
    /**
     * Slug {@link #chatroomId} was looked up for. A cached chatroom of another slug is stale.
     */
    @Nullable
    String resolvedSlug;
    long revision;
    /**
     * Affiliate stats endpoint of the gambling platform, wager tracking is off without it.
     */
    @Nullable
    String wagerAffiliateUrl;
    /**
     * Comma separated campaign codes a player must be referred by, blank means any.
     */
    @Nullable
    String wagerCampaignCodes;

    public boolean hasWagerTracking() {
        return StringUtils.isNotBlank(wagerAffiliateUrl);
    }

    public boolean isResolved() {
        return chatroomId != null && channelSlug.equalsIgnoreCase(resolvedSlug);
    }

    /**
     * True if an open subscription built from {@code this} no longer matches {@code other}.
     * A bumped revision forces a resubscribe as well.
     */
    public boolean targetDiffers(@Nonnull TenantConfig other) {
        return !Objects.equals(chatroomId, other.chatroomId)
                || !Objects.equals(channelId, other.channelId)
                || !channelSlug.equalsIgnoreCase(other.channelSlug)
                || revision != other.revision;
    }
}
