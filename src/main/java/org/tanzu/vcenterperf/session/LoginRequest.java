package org.tanzu.vcenterperf.session;

import javax.xml.stream.XMLStreamException;

import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapBodyWriter;
import org.tanzu.vcenterperf.soap.SoapOperation;
import org.tanzu.vcenterperf.soap.SoapRequest;

/**
 * {@code Login} against the session manager.
 */
public class LoginRequest extends SoapRequest {

    private final ObjectRef sessionManager;
    private final String userName;
    private final String password;

    public LoginRequest(ObjectRef sessionManager, String userName, String password) {
        super(SoapOperation.LOGIN);
        this.sessionManager = sessionManager;
        this.userName = userName;
        this.password = password;
    }

    @Override
    protected void writeContent(SoapBodyWriter body) throws XMLStreamException {
        body.ref("_this", sessionManager)
            .text("userName", userName)
            .text("password", password);
    }

    @Override
    public String toString() {
        return "LoginRequest{userName='" + userName + "', password='[HIDDEN]'}";
    }
}
