package com.swingtrading.portfolio;

/**
 * How the per-position allocation is derived. Both modes are constant within
 * a bar and never look at free capital, so a position is either fully funded
 * or not opened at all.
 */
public enum SizingMode {
    /** initial capital / max positions for the whole run (default) */
    FIXED_INITIAL,
    /** (initial capital + settled realized P&L) / max positions, opt-in compounding */
    REALIZED_EQUITY
}
