// file: src/main/java/io/gitty/core/game/GameStatus.java
package io.gitty.core.game;

public enum GameStatus {
    IN_PROGRESS, WON, ABANDONED;

    public boolean isTerminal() { return this != IN_PROGRESS; }
}
