package io.symdiff.core.error;

/**
 * Abstract parent for errors raised while reducing a tree to a value. Also raised at tree
 * construction time when the simplifier folds two constants whose combination is undefined.
 */
public abstract class EvaluationException extends SymbolicException {

    private static final long serialVersionUID = 1L;

    protected EvaluationException(String message, ErrorKind kind) {
        super(message, kind, Phase.EVALUATION);
    }
}
