package com.deigmueller.em_link.common.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

class NetUtilsTest {

  @Test
  @DisplayName("detectPrimaryIpAddress always returns an address")
  void detectPrimaryIpAddressAlwaysReturnsAnAddress() {
    String ipAddress = NetUtils.detectPrimaryIpAddress();

    assertThat(ipAddress, is(notNullValue()));
    assertThat(ipAddress.isBlank(), is(false));
  }

  @Test
  @DisplayName("normalizeIdentity strips separators and upper cases")
  void normalizeIdentityStripsSeparators() {
    assertThat(NetUtils.normalizeIdentity(" aa:bb:cc:dd:ee:0f "), is("AABBCCDDEE0F"));
    assertThat(NetUtils.normalizeIdentity("aa-bb-cc-dd-ee-0f"), is("AABBCCDDEE0F"));
    assertThat(NetUtils.normalizeIdentity("AABBCCDDEE0F"), is("AABBCCDDEE0F"));
  }

  @Test
  @DisplayName("unwrap removes nested completion wrappers")
  void unwrapRemovesNestedWrappers() {
    IOException cause = new IOException("boom");
    Throwable wrapped = new CompletionException(new ExecutionException(cause));

    assertThat(NetUtils.unwrap(wrapped), is(sameInstance(cause)));
    assertThat(NetUtils.describe(wrapped), is("boom"));
  }

  @Test
  @DisplayName("describe falls back to the class name")
  void describeFallsBackToClassName() {
    assertThat(NetUtils.describe(new IllegalStateException()), is("IllegalStateException"));
    assertThat(NetUtils.describe(null), is("unknown failure"));
  }
}
