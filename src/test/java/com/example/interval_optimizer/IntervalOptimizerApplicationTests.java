package com.example.interval_optimizer;

import com.example.interval_optimizer.cli.OptimizeRunner;
import com.example.interval_optimizer.config.OptimizerProperties;
import com.example.interval_optimizer.selector.IntervalSelector;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class IntervalOptimizerApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoadsWithoutCommandLineDriver() {
        assertThat(context.getBean(IntervalSelector.class)).isNotNull();
        assertThat(context.getBean(OptimizerProperties.class).getDefaultTradeOff()).isEqualTo(0.5);
        assertThat(context.getBeansOfType(OptimizeRunner.class)).isEmpty();
    }
}
