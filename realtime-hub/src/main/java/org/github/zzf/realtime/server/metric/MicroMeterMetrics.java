package org.github.zzf.realtime.server.metric;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Builder
public class MicroMeterMetrics {

    final String appName;
    /* 192.168.0.12:9090, null means no exporter */
    final String prometheusExportAddress;

    /**
     * @return the bound address of the Prometheus exporter, null if there is none
     */
    public InetSocketAddress init() {
        log.info("MicroMeterMetrics appName: {}", appName);
        Metrics.globalRegistry.config().commonTags("application", appName);
        InetSocketAddress exporter = null;
        if (prometheusExportAddress != null) {
            log.info("MicroMeterMetrics prometheusExport: {}", prometheusExportAddress);
            exporter = initPrometheusExporter(prometheusExportAddress);
        }
        initMetrics();
        return exporter;
    }

    private InetSocketAddress initPrometheusExporter(String exportAddress) {
        String[] hostAndPort = exportAddress.split(":");
        InetSocketAddress address = new InetSocketAddress(hostAndPort[0], Integer.parseInt(hostAndPort[1]));
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Metrics.addRegistry(registry);
        try {
            HttpServer server = HttpServer.create(address, 0);
            server.createContext("/metrics", httpExchange -> {
                byte[] response = registry.scrape().getBytes(StandardCharsets.UTF_8);
                httpExchange.sendResponseHeaders(200, response.length);
                try (OutputStream os = httpExchange.getResponseBody()) {
                    os.write(response);
                }
            });
            Thread thread = new Thread(server::start, "prometheus-http-server");
            thread.setDaemon(true);
            thread.start();
            InetSocketAddress listenedAddress = server.getAddress();
            log.info("prometheus exporter start success, bound: {}", listenedAddress);
            return listenedAddress;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void initMetrics() {
        MeterRegistry registry = Metrics.globalRegistry;
        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
    }

}
