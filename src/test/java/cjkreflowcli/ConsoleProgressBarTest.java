package cjkreflowcli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

class ConsoleProgressBarTest {

    @Test
    void drawsBarAndSkipsRepeatedPercent() {
        StringWriter sw = new StringWriter();
        ConsoleProgressBar bar = new ConsoleProgressBar(10, new PrintWriter(sw));

        bar.update(50);
        bar.update(50);
        bar.update(150);

        String lines = sw.toString();
        assertThat(lines).contains("[=====     ]  50%").contains("[==========] 100%");
        assertThat(lines.split("\r", -1)).hasSize(3);
        assertThat(bar.getLastPercent()).isEqualTo(100);
    }
}
