package io.gitty.server;

public enum Performance {
    UNDER_PAR, AT_PAR, OVER_PAR;

    static Performance of(int commandsUsed, int par) {
        if (commandsUsed < par) return UNDER_PAR;
        return commandsUsed == par ? AT_PAR : OVER_PAR;
    }
}
