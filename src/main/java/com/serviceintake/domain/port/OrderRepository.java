package com.serviceintake.domain.port;

import com.serviceintake.domain.model.ServiceOrder;

import java.util.List;

/**
 * Puerto (interfaz) para la persistencia de órdenes.
 */
public interface OrderRepository {

    /**
     * Inserta una orden y la sincroniza con el almacén.
     *
     * @param order Orden a guardar
     * @return Orden con id asignado
     */
    ServiceOrder insert(ServiceOrder order);

    /**
     * Obtiene las órdenes de un cliente en orden de creación.
     */
    List<ServiceOrder> findByCustomer(Long customerId);
}
