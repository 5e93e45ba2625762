package com.mobifone.broker.common;

public class Constants {
    public interface CONNECTION {
        String BASE_PATH      = "/connection";
        String SKIP_CHECKING  = "skipChecking";
        String UDS_LINK       = "udslink";
        String PASSWORD_PARAM = "password";
        String SCRAMBLER_HEADER = "X-Scrambler";
        String UNKNOWN_PASSWORD = "UNKNOWN";
    }

    public interface OPENSTACK {
        interface ENDPOINT {
            // relative, region prefix is added by the backend
            String AUTHENTICATION  = "/v3/auth/tokens";
            String PROVISION       = "/vdi/provision_infra/personal";
            String TASK_STATUS     = "/vdi/tasks/{taskId}";
            String DELETE_RESOURCE = "/vdi/delete_resource/{idInstance}";
        }

        String NAME_SERVICE = "OPENSTACK";
        String TOKEN_HEADER = "x-subject-token";
    }

    public interface PROVISIONING {
        String EXCHANGE    = "broker.provisioning";
        String QUEUE       = "broker.provisioning.events";
        String ROUTING_KEY = "instance";
    }

    public interface ROLE {
        String ADMIN = "admin";
    }
}
