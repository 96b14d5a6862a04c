package com.flowpilot.config;

import com.google.common.util.concurrent.Striped;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.locks.Lock;

/**
 * Guava 组件配置。
 * <p>
 * 按运行 ID 分段的锁，用于串行化同一运行的回复与取消。
 * </p>
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "runLocks")
    public Striped<Lock> runLocks(@Value("${flow.lock.stripes:64}") int stripes) {
        return Striped.lazyWeakLock(Math.max(stripes, 1));
    }

}
