package net.spookly.routekv.kv;

import java.io.File;
import java.net.URI;
import java.net.URISyntaxException;

import javax.net.ssl.SSLException;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.ClientBuilder;
import io.netty.handler.ssl.ApplicationProtocolConfig;
import io.netty.handler.ssl.ApplicationProtocolNames;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import net.spookly.routekv.config.ConfigException;
import net.spookly.routekv.config.RouteKvConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Builds the etcd client once at startup from the {@code kv} config section.
 */
public final class EtcdClientFactory {
    private static final Logger LOG = LoggerFactory.getLogger(EtcdClientFactory.class);

    private EtcdClientFactory() {
    }

    public static EtcdKvClient create(RouteKvConfig.KvConfig kv) {
        ClientBuilder builder = Client.builder().endpoints(endpoint(kv));
        if (hasText(kv.password)) {
            builder.user(ByteSequence.from(kv.username, UTF_8))
                    .password(ByteSequence.from(kv.password, UTF_8));
        }
        if (usesTls(kv)) {
            builder.sslContext(sslContext(kv));
        }
        LOG.info("Connecting to etcd at {} (tls={}, auth={})", kv.url, usesTls(kv), hasText(kv.password));
        return new EtcdKvClient(builder.build());
    }

    /**
     * Endpoint URL for the client, with the scheme switched to https when TLS material is set.
     */
    static String endpoint(RouteKvConfig.KvConfig kv) {
        URI uri = parse(kv.url);
        String scheme = usesTls(kv) ? "https" : uri.getScheme();
        return scheme + "://" + uri.getHost() + ":" + uri.getPort();
    }

    /**
     * {@code host:port} part of the URL.
     */
    public static String hostAndPort(String url) {
        URI uri = parse(url);
        return uri.getHost() + ":" + uri.getPort();
    }

    static boolean usesTls(RouteKvConfig.KvConfig kv) {
        return hasText(kv.caCert) || hasText(kv.clientCert);
    }

    private static SslContext sslContext(RouteKvConfig.KvConfig kv) {
        SslContextBuilder builder = SslContextBuilder.forClient()
                .applicationProtocolConfig(new ApplicationProtocolConfig(
                        ApplicationProtocolConfig.Protocol.ALPN,
                        ApplicationProtocolConfig.SelectorFailureBehavior.NO_ADVERTISE,
                        ApplicationProtocolConfig.SelectedListenerFailureBehavior.ACCEPT,
                        ApplicationProtocolNames.HTTP_2
                ));
        if (hasText(kv.caCert)) {
            builder.trustManager(new File(kv.caCert));
        }
        if (hasText(kv.clientCert)) {
            builder.keyManager(new File(kv.clientCert), new File(kv.clientKey));
        }
        try {
            return builder.build();
        } catch (SSLException e) {
            throw new ConfigException("Failed to load etcd TLS material", e);
        }
    }

    private static URI parse(String url) {
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new ConfigException("Invalid kv.url: " + url, e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
