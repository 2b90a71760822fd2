package io.b2mash.tender.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Values applied when a create-tender request leaves them out.
 *
 * @param votingDuration how long approval voting stays open after creation
 * @param requiredYesVotes yes-votes needed for automatic approval
 */
@ConfigurationProperties(prefix = "tender.defaults")
public record TenderDefaultsProperties(
    @DefaultValue("P7D") Duration votingDuration, @DefaultValue("3") int requiredYesVotes) {}
