package com.codeheadsystems.netdash.client.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.netdash.model.api.ApiVersionInfo;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class TimeoutPolicyTest {

  private static final DeviceProfile SLOW = DeviceProfile.fixed(ApiVersionInfo.ofModel("fbxgw-r1/full", "Freebox Revolution"));
  private static final DeviceProfile NORMAL = DeviceProfile.fixed(ApiVersionInfo.ofModel("fbxgw7-r1/full", "Freebox Delta"));

  private final TimeoutPolicy policy = new TimeoutPolicy(Duration.ofSeconds(10));

  @Test
  void deadlineFor_normalDevice_isDefaultEverywhere() {
    assertThat(policy.deadlineFor("/system/", NORMAL)).isEqualTo(Duration.ofSeconds(10));
    assertThat(policy.deadlineFor("/dhcp/dynamic_lease/", NORMAL)).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void deadlineFor_slowDeviceSlowEndpoint_is45s() {
    assertThat(policy.deadlineFor("/dhcp/dynamic_lease/", SLOW)).isEqualTo(Duration.ofMillis(45_000));
    assertThat(policy.deadlineFor("/dhcp/static_lease/3", SLOW)).isEqualTo(Duration.ofMillis(45_000));
    assertThat(policy.deadlineFor("/fw/redir/", SLOW)).isEqualTo(Duration.ofMillis(45_000));
    assertThat(policy.deadlineFor("/lan/browser/pub/", SLOW)).isEqualTo(Duration.ofMillis(45_000));
  }

  @Test
  void deadlineFor_slowDeviceOtherEndpoint_is25s() {
    assertThat(policy.deadlineFor("/system/", SLOW)).isEqualTo(Duration.ofMillis(25_000));
  }

  @Test
  void deadlineFor_unidentifiedDevice_isDefault() {
    DeviceProfile unknown = new DeviceProfile(null, null, Duration.ofSeconds(1), Duration.ofSeconds(1));

    assertThat(policy.deadlineFor("/dhcp/dynamic_lease/", unknown)).isEqualTo(Duration.ofSeconds(10));
  }
}
