package bench;

import bridge.impl.AnalysisLineHandler;
import bridge.impl.LineFramer;
import bridge.impl.UciLines;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/** Micro-benchmark: framing + multi-PV parsing of one depth-20 analysis transcript. */
@BenchmarkMode(Mode.Throughput)            // higher = better
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5,  time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(2)
public class LineFramingBench {

    /** One transcript, pre-cut into pipe-sized chunks at stable random points. */
    @State(Scope.Thread)
    public static class Transcript {
        @Param({"64", "4096"})
        int maxChunk;

        byte[] bytes;
        int[] cuts;

        @Setup(Level.Trial)
        public void init() {
            StringBuilder sb = new StringBuilder("info string NNUE evaluation enabled\n");
            String[] first = {"e2e4", "d2d4", "g1f3"};
            for (int depth = 1; depth <= 20; depth++) {
                for (int pv = 1; pv <= 3; pv++) {
                    sb.append("info depth ").append(depth)
                      .append(" seldepth ").append(depth + 4)
                      .append(" multipv ").append(pv)
                      .append(" score cp ").append(40 - 5 * pv)
                      .append(" nodes ").append(depth * 12_345L)
                      .append(" nps 1200000 hashfull 12 tbhits 0 time ").append(depth * 7)
                      .append(" pv ").append(first[pv - 1]).append(" e7e5 g1f3 b8c6 f1b5 a7a6\n");
                }
            }
            sb.append("bestmove e2e4 ponder e7e5\n");
            bytes = sb.toString().getBytes(StandardCharsets.UTF_8);

            SplittableRandom rng = new SplittableRandom(42);
            int[] tmp = new int[bytes.length + 1];
            int n = 0, pos = 0;
            while (pos < bytes.length) {
                pos = Math.min(bytes.length, pos + 1 + rng.nextInt(maxChunk));
                tmp[n++] = pos;
            }
            cuts = Arrays.copyOf(tmp, n);
        }
    }

    @Benchmark
    public void frameOnly(Transcript t, Blackhole bh) {
        LineFramer framer = new LineFramer();
        int from = 0;
        for (int cut : t.cuts) {
            framer.feed(t.bytes, from, cut - from, bh::consume);
            from = cut;
        }
    }

    @Benchmark
    public int frameAndRank(Transcript t) {
        LineFramer framer = new LineFramer();
        AnalysisLineHandler handler = new AnalysisLineHandler();
        int from = 0;
        for (int cut : t.cuts) {
            framer.feed(t.bytes, from, cut - from, handler::onLine);
            from = cut;
        }
        return handler.result().size();
    }

    @Benchmark
    public void parseOnly(Transcript t, Blackhole bh) {
        LineFramer framer = new LineFramer();
        framer.feed(t.bytes, line -> bh.consume(UciLines.parsePvInfo(line)));
    }
}
