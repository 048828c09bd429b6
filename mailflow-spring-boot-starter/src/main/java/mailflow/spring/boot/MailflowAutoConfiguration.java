package mailflow.spring.boot;

import mailflow.Mailflow;
import mailflow.dispatch.ExponentialBackoffRetryPolicy;
import mailflow.flow.FlowEngine;
import mailflow.jdbc.DataSourceConnectionProvider;
import mailflow.jdbc.store.JdbcStores;
import mailflow.ledger.SendLedger;
import mailflow.spi.CampaignContentProvider;
import mailflow.spi.CampaignCounters;
import mailflow.spi.ConnectionProvider;
import mailflow.spi.CustomerDirectory;
import mailflow.spi.DeliveryProvider;
import mailflow.spi.MetricsExporter;
import mailflow.spi.OrderDirectory;
import mailflow.spi.StorefrontClient;
import mailflow.spi.SuppressionList;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wires a {@link Mailflow} runtime from a {@link DataSource} and {@link MailflowProperties}.
 *
 * <p>The stores and connection provider are always created. The runtime itself needs the
 * application to supply a {@link DeliveryProvider}, a {@link CampaignContentProvider}, a
 * {@link CustomerDirectory} and an {@link OrderDirectory}; {@link StorefrontClient},
 * {@link SuppressionList}, {@link CampaignCounters} and {@link MetricsExporter} beans are
 * picked up when present.
 *
 * @see MailflowMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Mailflow.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "mailflow", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MailflowProperties.class)
public class MailflowAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public JdbcStores mailflowStores(DataSource dataSource) {
    return JdbcStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnBean({DeliveryProvider.class, CampaignContentProvider.class,
      CustomerDirectory.class, OrderDirectory.class})
  static class RuntimeConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Mailflow mailflow(MailflowProperties props,
                             ConnectionProvider connectionProvider,
                             JdbcStores stores,
                             DeliveryProvider deliveryProvider,
                             CampaignContentProvider contentProvider,
                             CustomerDirectory customerDirectory,
                             OrderDirectory orderDirectory,
                             ObjectProvider<StorefrontClient> storefrontProvider,
                             ObjectProvider<SuppressionList> suppressionProvider,
                             ObjectProvider<CampaignCounters> countersProvider,
                             ObjectProvider<MetricsExporter> metricsProvider) {
      var retry = props.getRetry();
      var builder = Mailflow.builder()
          .connectionProvider(connectionProvider)
          .ledgerStore(stores.sendLedgerStore())
          .flowStore(stores.flowDefinitionStore())
          .executionStore(stores.flowExecutionStore())
          .signalStore(stores.stepSignalStore())
          .deliveryProvider(deliveryProvider)
          .contentProvider(contentProvider)
          .customerDirectory(customerDirectory)
          .orderDirectory(orderDirectory)
          .lockTimeout(props.getLockTimeout())
          .maxAttempts(props.getMaxAttempts())
          .retryPolicy(new ExponentialBackoffRetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(),
              retry.isJitter()))
          .workerCount(props.getDispatcher().getWorkerCount())
          .hotQueueCapacity(props.getDispatcher().getHotQueueCapacity())
          .coldQueueCapacity(props.getDispatcher().getColdQueueCapacity())
          .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs())
          .pollIntervalMs(props.getPoller().getIntervalMs())
          .pollBatchSize(props.getPoller().getBatchSize())
          .sweepIntervalSeconds(props.getSweeper().getIntervalSeconds())
          .stepIntervalMs(props.getSteps().getIntervalMs())
          .stepBatchSize(props.getSteps().getBatchSize())
          .stepWorkerCount(props.getSteps().getWorkerCount());
      if (props.getWorkerId() != null && !props.getWorkerId().isBlank()) {
        builder.workerId(props.getWorkerId());
      }
      storefrontProvider.ifAvailable(builder::storefrontClient);
      suppressionProvider.ifAvailable(builder::suppressionList);
      countersProvider.ifAvailable(builder::campaignCounters);
      metricsProvider.ifAvailable(builder::metrics);

      Mailflow mailflow = builder.build();
      if (props.isAutoStart()) {
        mailflow.start();
      }
      return mailflow;
    }

    @Bean
    @ConditionalOnMissingBean
    public SendLedger sendLedger(Mailflow mailflow) {
      return mailflow.ledger();
    }

    @Bean
    @ConditionalOnMissingBean
    public FlowEngine flowEngine(Mailflow mailflow) {
      return mailflow.engine();
    }
  }
}
