package com.scoutharvest.core.crawler;

/** 페이지네이션 상태: AT_PAGE(n) → … → EXHAUSTED | BUDGET_REACHED */
public record PaginationState(Phase phase, int page) {

    public enum Phase { AT_PAGE, EXHAUSTED, BUDGET_REACHED }

    public static final PaginationState EXHAUSTED = new PaginationState(Phase.EXHAUSTED, -1);
    public static final PaginationState BUDGET_REACHED = new PaginationState(Phase.BUDGET_REACHED, -1);

    public static PaginationState atPage(int n) { return new PaginationState(Phase.AT_PAGE, n); }

    public boolean isTerminal() { return phase != Phase.AT_PAGE; }

    @Override public String toString() {
        return phase == Phase.AT_PAGE ? "AT_PAGE(" + page + ")" : phase.name();
    }
}
