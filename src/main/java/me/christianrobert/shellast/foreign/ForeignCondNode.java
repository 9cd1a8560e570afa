package me.christianrobert.shellast.foreign;

/**
 * Node of a {@code [[ ]]} expression tree.
 *
 * <p>Unary nodes keep their operand in the left child's {@code op} word. Binary nodes keep the
 * operator in their own {@code op} word and the operands in the children's {@code op} words.
 */
public interface ForeignCondNode {

    /** Node type, see {@code ForeignFlags.COND_*}. */
    int getType();

    int getFlags();

    ForeignWord getOp();

    ForeignCondNode getLeft();

    ForeignCondNode getRight();
}
