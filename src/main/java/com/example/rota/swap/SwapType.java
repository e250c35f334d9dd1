package com.example.rota.swap;

import com.example.rota.shift.Shift;
import com.example.rota.staff.Staff;

/**
 * Kind of exchange a staff member asks for, each with its own effect on the shift once approved.
 */
public enum SwapType {

    /** Hand the shift to a named colleague. */
    SWAP {
        @Override
        public boolean requiresReplacement() {
            return true;
        }

        @Override
        void resolve(Shift shift, Staff replacement) {
            shift.assignTo(replacement);
        }
    },

    /** Give the shift up; it goes back to the open pool. */
    DROP {
        @Override
        public boolean requiresReplacement() {
            return false;
        }

        @Override
        void resolve(Shift shift, Staff replacement) {
            shift.assignTo(null);
        }
    };

    public abstract boolean requiresReplacement();

    abstract void resolve(Shift shift, Staff replacement);
}
