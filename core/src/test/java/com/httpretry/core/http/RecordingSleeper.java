package com.httpretry.core.http;

import com.httpretry.core.util.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** 테스트용 Sleeper: 실제로 자지 않고 sleep(Duration) 호출만 기록 */
final class RecordingSleeper implements Sleeper {
    final List<Duration> sleeps = new ArrayList<>();
    @Override public void sleep(Duration d) { sleeps.add(d); }
}
