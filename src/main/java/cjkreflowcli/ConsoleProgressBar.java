package cjkreflowcli;

import java.io.PrintWriter;

class ConsoleProgressBar {
    private final int width;
    private final PrintWriter out;
    private int lastPercent = -1;

    ConsoleProgressBar(int width, PrintWriter out) {
        this.width = width;
        this.out = out;
    }

    void update(int percent) {
        percent = Math.max(0, Math.min(100, percent));
        if (percent == lastPercent) {
            return; // avoid noisy updates
        }
        lastPercent = percent;

        int filled = percent * width / 100;
        StringBuilder sb = new StringBuilder();
        sb.append('\r'); // carriage return: overwrite same line
        sb.append("[");
        for (int i = 0; i < width; i++) {
            sb.append(i < filled ? '=' : ' ');
        }
        sb.append("] ");
        if (percent < 100) {
            sb.append(String.format("%3d%%", percent));
        } else {
            sb.append("100%");
        }

        out.print(sb);

        if (percent == 100) {
            out.println(); // move to next line at the end
        }
        out.flush();
    }

    int getLastPercent() {
        return lastPercent;
    }
}
