package io.atomledger.client.rxjava3;

import io.atomledger.client.AtomSubmissionState;
import io.atomledger.client.AtomUpdate;
import io.atomledger.client.ConnectionStatus;
import io.atomledger.client.NodeConnection;
import io.atomledger.core.EUID;
import io.atomledger.core.atom.Atom;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;

import java.util.Objects;
import java.util.Set;

/**
 * RxJava3 adapter over {@link NodeConnection}.
 *
 * <p>Operations start when the method is called, as they do on the wrapped connection.
 */
public final class RxJavaNodeConnection implements AutoCloseable {

    private final NodeConnection delegate;

    public RxJavaNodeConnection(NodeConnection delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public NodeConnection delegate() {
        return delegate;
    }

    public Completable open() {
        return Completable.fromPublisher(delegate.open());
    }

    public Flowable<AtomUpdate> subscribe(String address) {
        return Flowable.fromPublisher(delegate.subscribe(address));
    }

    public Completable unsubscribe(String address) {
        return Completable.fromPublisher(delegate.unsubscribe(address));
    }

    public Completable unsubscribeAll() {
        return Completable.fromPublisher(delegate.unsubscribeAll());
    }

    public Flowable<Boolean> isSynced(String address) {
        return Flowable.fromPublisher(delegate.isSynced(address));
    }

    public Flowable<AtomSubmissionState> submitAtom(Atom atom) {
        return Flowable.fromPublisher(delegate.submitAtom(atom));
    }

    public Single<Atom> getAtomById(EUID id) {
        return Single.fromPublisher(delegate.getAtomById(id));
    }

    public Flowable<ConnectionStatus> status() {
        return Flowable.fromPublisher(delegate.status());
    }

    public boolean isReady() {
        return delegate.isReady();
    }

    public Set<String> subscribedAddresses() {
        return delegate.subscribedAddresses();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
