package org.jafc.compiler.frontend.parser.ast.expr;

/**
 * {@code struct.member}. Analysis binds it to the member index.
 */
public final class MemberExpression extends Expression {

    private Expression struct;
    private final String memberName;
    private int memberNo = -1;

    public MemberExpression(Expression struct, String memberName) {
        this.struct = struct;
        this.memberName = memberName;
    }

    public Expression struct() {
        return struct;
    }

    public void setStruct(Expression struct) {
        this.struct = struct;
    }

    public String memberName() {
        return memberName;
    }

    public int memberNo() {
        return memberNo;
    }

    public void setMemberNo(int memberNo) {
        this.memberNo = memberNo;
    }

    @Override
    public String toString() {
        return struct + "." + memberName;
    }
}
