package com.comments.capture.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;

/**
 * OpenTelemetry SDK for the edge. Spring Boot builds the Micrometer tracer and
 * observation handlers on top of this bean; the span export runs on a batch
 * thread so it never adds latency to the capture request.
 */
@Configuration
public class TracingConfiguration {

        private static final Logger log = LoggerFactory.getLogger(TracingConfiguration.class);

        private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

        @Value("${spring.application.name}")
        private String serviceName;

        @Value("${management.otlp.tracing.endpoint}")
        private String otlpEndpoint;

        @Bean
        public OpenTelemetry openTelemetry() {
                log.info("Configuring OpenTelemetry for {} with endpoint: {}", serviceName, otlpEndpoint);

                Resource resource = Resource.getDefault()
                                .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));

                SdkTracerProvider sdkTracerProvider = SdkTracerProvider.builder()
                                .addSpanProcessor(BatchSpanProcessor.builder(
                                                OtlpGrpcSpanExporter.builder()
                                                                .setEndpoint(otlpEndpoint)
                                                                .build())
                                                .build())
                                .setResource(resource)
                                .build();

                OpenTelemetrySdk openTelemetrySdk = OpenTelemetrySdk.builder()
                                .setTracerProvider(sdkTracerProvider)
                                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                                .build();

                log.info("OpenTelemetry configured successfully");
                return openTelemetrySdk;
        }
}
