package bridge.impl;

import bridge.contracts.RulesEngine;
import bridge.errors.InvalidPositionException;

import java.util.Optional;

/**
 * Fallback rules engine that knows FEN <em>syntax</em> and nothing else: it
 * rejects malformed strings but cannot play moves, so it never reports mate.
 */
public final class StructuralRulesEngine implements RulesEngine {

    private static final String PIECES = "pnbrqkPNBRQK";

    @Override
    public void validatePosition(String fen) {
        if (fen == null || fen.isBlank()) throw new InvalidPositionException(String.valueOf(fen), "empty FEN");
        String[] f = fen.trim().split("\\s+");
        if (f.length != 6) fail(fen, "expected 6 fields, found " + f.length);

        checkBoard(fen, f[0]);
        if (!f[1].equals("w") && !f[1].equals("b")) fail(fen, "side to move must be 'w' or 'b'");
        if (!f[2].matches("-|K?Q?k?q?")) fail(fen, "bad castling field '" + f[2] + "'");
        if (!f[3].matches("-|[a-h][36]")) fail(fen, "bad en-passant field '" + f[3] + "'");
        if (!f[4].matches("\\d+")) fail(fen, "bad halfmove clock '" + f[4] + "'");
        if (!f[5].matches("\\d+") || Integer.parseInt(f[5]) < 1) fail(fen, "bad fullmove number '" + f[5] + "'");
    }

    private static void checkBoard(String fen, String board) {
        String[] ranks = board.split("/", -1);
        if (ranks.length != 8) fail(fen, "expected 8 ranks, found " + ranks.length);
        int whiteKings = 0, blackKings = 0;
        for (int r = 0; r < 8; r++) {
            int files = 0;
            boolean lastWasDigit = false;
            for (char c : ranks[r].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    if (lastWasDigit) fail(fen, "consecutive digits in rank " + (8 - r));
                    files += c - '0';
                    lastWasDigit = true;
                } else if (PIECES.indexOf(c) >= 0) {
                    files++;
                    lastWasDigit = false;
                    if (c == 'K') whiteKings++;
                    if (c == 'k') blackKings++;
                } else {
                    fail(fen, "unexpected '" + c + "' in rank " + (8 - r));
                }
            }
            if (files != 8) fail(fen, "rank " + (8 - r) + " covers " + files + " files");
        }
        if (whiteKings != 1 || blackKings != 1) fail(fen, "each side needs exactly one king");
    }

    private static void fail(String fen, String reason) {
        throw new InvalidPositionException(fen, reason);
    }

    @Override
    public Optional<String> applyMove(String fen, String uciMove) {
        return Optional.empty();
    }

    @Override
    public boolean isCheckmate(String fen) {
        return false;
    }
}
