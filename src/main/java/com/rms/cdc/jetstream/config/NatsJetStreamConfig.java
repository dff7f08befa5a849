package com.rms.cdc.jetstream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.KeyValueManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * Spring configuration that wires up:
 * - NATS {@link Connection}
 * - JetStream handles ({@link JetStream}, {@link JetStreamManagement}, {@link KeyValueManagement})
 * - Property binding for the node, delivery and ingress settings
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Create one shared NATS connection for the application lifecycle.</li>
 *   <li>Support no-auth, user/password, token and creds authentication, with optional TLS.</li>
 * </ul>
 *
 * The ingress consumer pulls changes through {@link JetStream}; the keyed store
 * and its bootstrapper use the key/value APIs.
 */
@Configuration
@EnableConfigurationProperties({
        CdcProperties.class,       // connection settings (url, auth, tls flags)
        DeliveryProperties.class,  // delivery mode and keyed target
        IngressProperties.class    // change stream pull subscription
})
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    /**
     * Creates the NATS {@link Connection} bean.
     *
     * <p><b>Lifecycle</b></p>
     * <ul>
     *   <li>Declared with {@code destroyMethod="close"} so the connection is closed on shutdown.</li>
     *   <li>Connect failures fail context startup; there is no fallback connect path.</li>
     * </ul>
     *
     * <p><b>Security note</b></p>
     * <ul>
     *   <li>The username is masked in logs; passwords and tokens are never printed.</li>
     * </ul>
     */
    @Bean(destroyMethod = "close")
    public Connection natsConnection(CdcProperties props) throws Exception {
        Options.Builder builder = Options.builder().server(props.getNatsUrl());

        if (props.isNatsTls()) {
            builder.secure();
        }
        if (hasText(props.getNatsToken())) {
            builder.token(props.getNatsToken().toCharArray());
        }
        if (hasText(props.getNatsUser())) {
            String pass = props.getNatsPassword() == null ? "" : props.getNatsPassword();
            builder.userInfo(props.getNatsUser(), pass);
        }
        if (hasText(props.getNatsCreds())) {
            builder.authHandler(Nats.credentials(props.getNatsCreds()));
        }

        Connection c = Nats.connect(builder.build());

        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                props.getNatsUrl(),
                props.isNatsTls(),
                mask(props.getNatsUser()),
                props.getNatsCreds() == null ? "" : props.getNatsCreds());
        return c;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws Exception {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws Exception {
        return connection.jetStreamManagement();
    }

    /** Bucket status and creation, used by the keyed-mode bootstrapper. */
    @Bean
    public KeyValueManagement keyValueManagement(Connection connection) throws Exception {
        return connection.keyValueManagement();
    }

    private static boolean hasText(String v) {
        return v != null && !v.isBlank();
    }

    static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
