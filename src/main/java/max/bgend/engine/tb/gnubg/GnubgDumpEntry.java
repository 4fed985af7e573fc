package max.bgend.engine.tb.gnubg;

import max.bgend.engine.tb.MoveCountDistribution;

public record GnubgDumpEntry(String positionId, MoveCountDistribution distribution) {
}
