package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.syntax.NodeRenderer;

/**
 * Field or property access. The receiver is {@code null} for a static member.
 */
public final class MemberNode implements Node {

    private final Node receiver;
    private final MemberRef member;

    MemberNode(Node receiver, MemberRef member) {
        this.receiver = receiver;
        this.member = member;
    }

    public Node getReceiver() {
        return receiver;
    }

    public MemberRef getMember() {
        return member;
    }

    @Override
    public Class<?> getType() {
        return member.getType();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.MEMBER;
    }

    @Override
    public boolean canRead() {
        return member.canRead();
    }

    @Override
    public boolean canWrite() {
        return member.canWrite();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMember(this);
    }

    @Override
    public String toString() {
        return NodeRenderer.render(this);
    }
}
