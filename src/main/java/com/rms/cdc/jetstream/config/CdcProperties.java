package com.rms.cdc.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Base settings of a CDC node:
 * <ul>
 *   <li><b>Node identity</b>, used to derive the default durable consumer name.</li>
 *   <li><b>NATS connection settings</b> (URL plus optional auth/TLS).</li>
 * </ul>
 *
 * <h2>Binding</h2>
 * <pre>
 * cdc:
 *   node-id: node01
 *   nats-url: nats://localhost:4222
 *   nats-user: ...
 *   nats-password: ...
 *   nats-token: ...
 *   nats-creds: /path/to/user.creds
 *   nats-tls: false
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>Blank node id or URL fails startup (Bean Validation).</li>
 *   <li>Secrets should come from environment variables or a secrets manager,
 *       not from committed config files.</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "cdc")
public class CdcProperties {

    // ---------------------------------------------------------------------
    // Node identity (used in durable consumer names)
    // ---------------------------------------------------------------------

    /**
     * Stable name of this node.
     *
     * <p><b>Purpose</b></p>
     * <ul>
     *   <li>Default durable is {@code cdc_ingress_<nodeId>}, so a restarted node
     *       resumes from its own acknowledged position.</li>
     *   <li>Two nodes sharing a node id share one durable and split the stream.</li>
     * </ul>
     *
     * <p><b>Default</b>: {@code node01}</p>
     */
    @NotBlank
    private String nodeId = "node01";

    // ---------------------------------------------------------------------
    // NATS connectivity
    // ---------------------------------------------------------------------

    @NotBlank
    private String natsUrl = "nats://localhost:4222";

    // ---------------------------------------------------------------------
    // Optional authentication / TLS
    // ---------------------------------------------------------------------

    private String natsUser;

    private String natsPassword;

    private String natsToken;

    /** Path to a .creds file (JWT plus NKey seed). */
    private String natsCreds;

    private boolean natsTls = false;

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public String getNatsUrl() { return natsUrl; }
    public void setNatsUrl(String natsUrl) { this.natsUrl = natsUrl; }

    public String getNatsUser() { return natsUser; }
    public void setNatsUser(String natsUser) { this.natsUser = natsUser; }

    public String getNatsPassword() { return natsPassword; }
    public void setNatsPassword(String natsPassword) { this.natsPassword = natsPassword; }

    public String getNatsToken() { return natsToken; }
    public void setNatsToken(String natsToken) { this.natsToken = natsToken; }

    public String getNatsCreds() { return natsCreds; }
    public void setNatsCreds(String natsCreds) { this.natsCreds = natsCreds; }

    public boolean isNatsTls() { return natsTls; }
    public void setNatsTls(boolean natsTls) { this.natsTls = natsTls; }
}
