package com.ospicorp.analyticsapi;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.analyticsapi.analytics.service.ModelingCapabilities;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = "analytics.modeling.arima.enabled=false")
class SmokeTest {

  @Autowired
  private ApplicationContext context;

  @Test
  void contextLoadsWithConfiguredCapabilities() {
    assertThat(context).isNotNull();
    ModelingCapabilities capabilities = context.getBean(ModelingCapabilities.class);
    assertThat(capabilities.arimaEnabled()).isFalse();
    assertThat(capabilities.isolationForestEnabled()).isTrue();
  }
}
