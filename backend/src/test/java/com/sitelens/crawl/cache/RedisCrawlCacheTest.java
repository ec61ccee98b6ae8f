package com.sitelens.crawl.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisCrawlCacheTest {

  private StringRedisTemplate template;
  private ValueOperations<String, String> values;
  private RedisCrawlCache cache;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    template = mock(StringRedisTemplate.class);
    values = mock(ValueOperations.class);
    when(template.opsForValue()).thenReturn(values);
    cache = new RedisCrawlCache(template, "sitelens:");
  }

  @Test
  void keysArePrefixed() {
    when(values.get("sitelens:robots_txt:example.com")).thenReturn("{}");

    assertThat(cache.get("robots_txt:example.com")).contains("{}");
    cache.set("rate_limit:example.com", "v", Duration.ofSeconds(30));
    verify(values).set("sitelens:rate_limit:example.com", "v", Duration.ofSeconds(30));
  }

  @Test
  void deleteAndExistsReportRedisAnswers() {
    when(template.delete("sitelens:k")).thenReturn(true);
    when(template.hasKey("sitelens:missing")).thenReturn(null);

    assertThat(cache.delete("k")).isTrue();
    assertThat(cache.exists("missing")).isFalse();
  }

  @Test
  @SuppressWarnings("unchecked")
  void updateRetriesWhenWatchedKeyChanges() {
    RedisOperations<String, String> session = mock(RedisOperations.class);
    ValueOperations<String, String> sessionValues = mock(ValueOperations.class);
    when(session.opsForValue()).thenReturn(sessionValues);
    when(sessionValues.get("sitelens:rate_limit:example.com")).thenReturn("1", "2");
    when(session.exec()).thenReturn(List.of(), List.of("OK"));
    when(template.execute(any(SessionCallback.class)))
        .thenAnswer(invocation -> ((SessionCallback<?>) invocation.getArgument(0)).execute(session));

    String stored = cache.update("rate_limit:example.com", Duration.ofSeconds(60), current -> current + "0");

    assertThat(stored).isEqualTo("20");
    verify(session, times(2)).watch("sitelens:rate_limit:example.com");
    verify(session, times(2)).multi();
    verify(sessionValues).set("sitelens:rate_limit:example.com", "20", Duration.ofSeconds(60));
  }

  @Test
  void connectionFailuresBecomeCacheExceptions() {
    when(values.get("sitelens:k")).thenThrow(new RedisConnectionFailureException("refused"));

    assertThatThrownBy(() -> cache.get("k"))
        .isInstanceOf(CrawlCacheException.class)
        .hasMessageContaining("key=k");
  }

  @Test
  void unavailableWithoutConnectionFactory() {
    when(template.getConnectionFactory()).thenReturn(null);

    assertThat(cache.isAvailable()).isFalse();
    assertThat(cache.type()).isEqualTo("redis");
  }
}
