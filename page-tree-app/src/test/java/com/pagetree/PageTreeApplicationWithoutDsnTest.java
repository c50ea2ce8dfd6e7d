package com.pagetree;

import com.pagetree.command.ResolveRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(args = "--pid=3")
class PageTreeApplicationWithoutDsnTest {

    @Autowired
    private ResolveRunner runner;

    @Test
    void reportsFailureWithoutConnectionString() {
        assertThat(runner.getExitCode()).isNotZero();
    }
}
