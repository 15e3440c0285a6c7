package com.github.salilvnair.supportrouter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.supportrouter.llm.HttpRemoteModelClient;
import com.github.salilvnair.supportrouter.llm.RemoteModelClient;
import com.github.salilvnair.supportrouter.llm.RemoteModelInvoker;
import com.github.salilvnair.supportrouter.tenant.ClasspathTenantConfigSource;
import com.github.salilvnair.supportrouter.tenant.TenantConfigSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Conditional;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@AutoConfiguration
@ComponentScan(basePackages = "com.github.salilvnair.supportrouter")
@EnableConfigurationProperties
@EnableScheduling
public class SupportRouterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock supportRouterClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(TenantConfigSource.class)
    public TenantConfigSource classpathTenantConfigSource(SupportRouterProperties properties) {
        return new ClasspathTenantConfigSource(properties);
    }

    @Bean(name = RemoteModelInvoker.EXECUTOR_BEAN, destroyMethod = "shutdownNow")
    public ExecutorService supportRouterRemoteModelExecutor(SupportRouterProperties properties) {
        int poolSize = Math.max(1, properties.getRemoteModel().getPoolSize());
        int queueCapacity = Math.max(1, properties.getRemoteModel().getQueueCapacity());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "supportrouter-remote-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        // a full queue rejects the call and the invoker reports it as a failed remote call
        return new ThreadPoolExecutor(
                poolSize,
                poolSize,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean
    @Conditional(RemoteModelApiKeyPresentCondition.class)
    @ConditionalOnMissingBean(RemoteModelClient.class)
    public HttpRemoteModelClient httpRemoteModelClient(ObjectProvider<ObjectMapper> objectMapper,
                                                       SupportRouterProperties properties) {
        return new HttpRemoteModelClient(objectMapper.getIfAvailable(ObjectMapper::new), properties);
    }
}
